package ai.pipestream.transfer.config;

import ai.pipestream.transfer.archive.ArchiveSettings;
import ai.pipestream.transfer.client.ParallelChunkUploader;
import ai.pipestream.transfer.retry.RetrySettings;
import ai.pipestream.transfer.session.SessionSettings;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * Rejects invalid configuration combinations at startup instead of at the first upload.
 */
@ApplicationScoped
public class TransferConfigurationValidator {

    private static final Logger LOG = Logger.getLogger(TransferConfigurationValidator.class);

    void onStart(@Observes StartupEvent event, S3Config s3Config, TransferConfiguration config) {
        validate(s3Config, config);
    }

    static void validate(S3Config s3Config, TransferConfiguration config) {
        ArchiveSettings archive = ArchiveSettings.from(s3Config, config.archive());
        RetrySettings retry = RetrySettings.from(config.retry());
        SessionSettings session = SessionSettings.from(s3Config, config.upload());
        int concurrency = config.upload().clientConcurrency();
        if (concurrency < ParallelChunkUploader.MIN_CONCURRENCY || concurrency > ParallelChunkUploader.MAX_CONCURRENCY) {
            throw new IllegalArgumentException(String.format("transfer.upload.client-concurrency must be between %d and %d, got %d",
                    ParallelChunkUploader.MIN_CONCURRENCY, ParallelChunkUploader.MAX_CONCURRENCY, concurrency));
        }
        LOG.infof("Transfer configuration: chunkSize=%d, maxFiles=%d, partSize=%d, readWindow=%d, retries=%d, bucket=%s",
                session.chunkSize(), session.maxFiles(), archive.standardPartSize(), archive.readWindow(),
                retry.maxAttempts(), s3Config.bucket());
    }
}
