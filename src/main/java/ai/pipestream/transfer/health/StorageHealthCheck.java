package ai.pipestream.transfer.health;

import ai.pipestream.transfer.config.S3Config;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Health check for the Transfer Service.
 * Checks that the object store bucket is reachable.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private static final long TIMEOUT_SECONDS = 5;

    @Inject
    S3AsyncClient s3;

    @Inject
    S3Config config;

    @Override
    public HealthCheckResponse call() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(config.bucket()).build())
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            return HealthCheckResponse.named("transfer-service")
                    .withData("bucket", config.bucket())
                    .withData("storage", "reachable")
                    .up()
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down("interrupted");
        } catch (ExecutionException e) {
            return down(String.valueOf(e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
        } catch (TimeoutException e) {
            return down("no answer within " + TIMEOUT_SECONDS + "s");
        }
    }

    private HealthCheckResponse down(String error) {
        return HealthCheckResponse.named("transfer-service")
                .withData("bucket", config.bucket())
                .withData("storage", "unreachable")
                .withData("error", error)
                .down()
                .build();
    }
}
