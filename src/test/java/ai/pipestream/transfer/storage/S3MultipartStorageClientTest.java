package ai.pipestream.transfer.storage;

import ai.pipestream.transfer.exception.StorageCallException;
import ai.pipestream.transfer.observability.TransferObserver;
import ai.pipestream.transfer.retry.RetryPolicy;
import ai.pipestream.transfer.retry.RetrySettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3MultipartStorageClientTest {

    @Mock
    S3AsyncClient s3;

    private S3Presigner presigner;
    private S3MultipartStorageClient client;

    @BeforeEach
    void setUp() {
        presigner = S3Presigner.builder()
                .region(Region.US_EAST_1)
                .endpointOverride(URI.create("http://localhost:9000"))
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("key", "secret")))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .build();
        RetryPolicy retry = new RetryPolicy(new RetrySettings(3, Duration.ZERO, Duration.ZERO), TransferObserver.NOOP);
        client = new S3MultipartStorageClient(s3, presigner, retry, "bucket", Duration.ofMinutes(15));
    }

    @AfterEach
    void tearDown() {
        presigner.close();
    }

    private static S3Exception s3Error(int status) {
        return (S3Exception) S3Exception.builder().statusCode(status).message("status " + status).build();
    }

    @Test
    void transientCreateFailureIsRetried() {
        when(s3.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(s3Error(503)))
                .thenReturn(CompletableFuture.completedFuture(
                        CreateMultipartUploadResponse.builder().uploadId("u-1").build()));

        assertEquals("u-1", client.createMultipart("temp/s/a.bin").await().indefinitely());
        verify(s3, times(2)).createMultipartUpload(any(CreateMultipartUploadRequest.class));
    }

    @Test
    void permanentFailureKeepsProviderStatus() {
        when(s3.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(s3Error(403)));

        StorageCallException error = assertThrows(StorageCallException.class,
                () -> client.createMultipart("temp/s/a.bin").await().indefinitely());

        assertEquals(403, error.getStatusCode());
        assertEquals("createMultipart", error.getOperation());
        verify(s3, times(1)).createMultipartUpload(any(CreateMultipartUploadRequest.class));
    }

    @Test
    void completeSendsPartsInOrder() {
        when(s3.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(CompleteMultipartUploadResponse.builder().eTag("\"x\"").build()));

        client.completeMultipart("k", "u-1", List.of(new CompletedPartRef(1, "\"a\""), new CompletedPartRef(2, "\"b\"")))
                .await().indefinitely();

        ArgumentCaptor<CompleteMultipartUploadRequest> captor = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3).completeMultipartUpload(captor.capture());
        assertEquals("u-1", captor.getValue().uploadId());
        assertEquals(2, captor.getValue().multipartUpload().parts().size());
        assertEquals("\"b\"", captor.getValue().multipartUpload().parts().get(1).eTag());
    }

    @Test
    void completeRejectsUnorderedParts() {
        assertThrows(IllegalArgumentException.class, () -> client.completeMultipart("k", "u-1",
                List.of(new CompletedPartRef(2, "b"), new CompletedPartRef(1, "a"))));
    }

    @Test
    void completeOfAlreadyCompletedUploadSucceeds() {
        when(s3.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(
                        NoSuchUploadException.builder().statusCode(404).message("gone").build()));
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(HeadObjectResponse.builder().contentLength(10L).build()));

        assertDoesNotThrow(() -> client.completeMultipart("k", "u-1", List.of(new CompletedPartRef(1, "a")))
                .await().indefinitely());
    }

    @Test
    void completeOfAbortedUploadFails() {
        when(s3.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(
                        NoSuchUploadException.builder().statusCode(404).message("gone").build()));
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(NoSuchKeyException.builder().statusCode(404).build()));

        StorageCallException error = assertThrows(StorageCallException.class,
                () -> client.completeMultipart("k", "u-1", List.of(new CompletedPartRef(1, "a"))).await().indefinitely());
        assertEquals(404, error.getStatusCode());
    }

    @Test
    void abortNeverFails() {
        when(s3.abortMultipartUpload(any(AbortMultipartUploadRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(s3Error(500)));

        assertDoesNotThrow(() -> client.abortMultipart("k", "u-1").await().indefinitely());
        verify(s3, times(3)).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
    }

    @Test
    void partUrlsArePresigned() {
        PartUploadDescriptor descriptor = client.authorizePartUpload("temp/s/a.bin", "u-1", 3).await().indefinitely();

        assertEquals(3, descriptor.partNumber());
        assertTrue(descriptor.url().contains("partNumber=3"), descriptor.url());
        assertTrue(descriptor.url().contains("uploadId=u-1"), descriptor.url());
        assertTrue(descriptor.url().startsWith("http://localhost:9000/bucket/temp/s/a.bin"), descriptor.url());
        assertNotNull(descriptor.expiresAt());
    }

    @Test
    void invalidRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> client.getRange("k", 10, 5));
    }

    @Test
    void errorClassification() {
        assertTrue(S3MultipartStorageClient.isNoSuchUpload(NoSuchUploadException.builder().message("x").build()));
        assertFalse(S3MultipartStorageClient.isNoSuchUpload(s3Error(404)));
        assertTrue(S3MultipartStorageClient.isNotFound(s3Error(404)));
        assertFalse(S3MultipartStorageClient.isNotFound(s3Error(500)));
    }
}
