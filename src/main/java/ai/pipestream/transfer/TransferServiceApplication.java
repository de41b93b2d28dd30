package ai.pipestream.transfer;

import ai.pipestream.transfer.config.S3Config;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Entry point. Sessions land under the temp prefix and finished archives under the archive prefix.
 */
@QuarkusMain
public class TransferServiceApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(TransferServiceApplication.class);

    @Inject
    S3Config s3Config;

    public static void main(String... args) {
        Quarkus.run(TransferServiceApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.infof("Transfer service ready: endpoint=%s, bucket=%s, temp=%s/, archives=%s/",
                s3Config.endpoint(), s3Config.bucket(), s3Config.tempPrefix(), s3Config.archivePrefix());
        Quarkus.waitForExit();
        LOG.info("Transfer service shutting down");
        return 0;
    }
}
