package ai.pipestream.transfer.health;

import ai.pipestream.transfer.config.S3Config;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageHealthCheckTest {

    private StorageHealthCheck check;

    @BeforeEach
    void setUp() {
        check = new StorageHealthCheck();
        check.s3 = mock(S3AsyncClient.class);
        check.config = mock(S3Config.class);
        when(check.config.bucket()).thenReturn("transfers");
    }

    @Test
    void reachableBucketIsUp() {
        when(check.s3.headBucket(any(HeadBucketRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(HeadBucketResponse.builder().build()));

        HealthCheckResponse response = check.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("transfers", response.getData().orElseThrow().get("bucket"));
    }

    @Test
    void missingBucketIsDown() {
        when(check.s3.headBucket(any(HeadBucketRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(
                        NoSuchBucketException.builder().statusCode(404).message("no such bucket").build()));

        HealthCheckResponse response = check.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("unreachable", response.getData().orElseThrow().get("storage"));
        assertTrue(String.valueOf(response.getData().orElseThrow().get("error")).contains("no such bucket"));
    }
}
