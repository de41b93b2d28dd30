package ai.pipestream.transfer.storage;

import ai.pipestream.transfer.config.S3Config;
import ai.pipestream.transfer.exception.StorageCallException;
import ai.pipestream.transfer.retry.RetryPolicy;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedUploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.model.UploadPartPresignRequest;

import java.time.Duration;
import java.util.List;

/**
 * {@link MultipartStorageClient} backed by the AWS SDK v2 async client.
 * Returns Uni&lt;T&gt; for all operations instead of blocking.
 */
@ApplicationScoped
public class S3MultipartStorageClient implements MultipartStorageClient {

    private static final Logger LOG = Logger.getLogger(S3MultipartStorageClient.class);

    private final S3AsyncClient s3;
    private final S3Presigner presigner;
    private final RetryPolicy retry;
    private final String bucket;
    private final Duration presignTtl;

    @Inject
    public S3MultipartStorageClient(S3AsyncClient s3, S3Presigner presigner, RetryPolicy retry, S3Config config) {
        this(s3, presigner, retry, config.bucket(), config.presignTtl());
    }

    public S3MultipartStorageClient(S3AsyncClient s3, S3Presigner presigner, RetryPolicy retry,
                                    String bucket, Duration presignTtl) {
        this.s3 = s3;
        this.presigner = presigner;
        this.retry = retry;
        this.bucket = bucket;
        this.presignTtl = presignTtl;
    }

    @Override
    public Uni<String> createMultipart(String key) {
        CreateMultipartUploadRequest request = CreateMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.createMultipartUpload(request)),
                        "createMultipart " + key)
                .map(response -> {
                    LOG.debugf("Initiated multipart upload: key=%s, uploadId=%s", key, response.uploadId());
                    return response.uploadId();
                })
                .onFailure().transform(e -> failure("createMultipart", key, e));
    }

    @Override
    public Uni<PartUploadDescriptor> authorizePartUpload(String key, String multipartId, int partNumber) {
        return Uni.createFrom().item(() -> {
                    UploadPartPresignRequest request = UploadPartPresignRequest.builder()
                            .signatureDuration(presignTtl)
                            .uploadPartRequest(UploadPartRequest.builder()
                                    .bucket(bucket)
                                    .key(key)
                                    .uploadId(multipartId)
                                    .partNumber(partNumber)
                                    .build())
                            .build();
                    PresignedUploadPartRequest presigned = presigner.presignUploadPart(request);
                    return new PartUploadDescriptor(partNumber, presigned.url().toString(),
                            presigned.signedHeaders(), presigned.expiration());
                })
                .onFailure().transform(e -> failure("authorizePartUpload", key, e));
    }

    @Override
    public Uni<String> uploadPart(String key, String multipartId, int partNumber, byte[] bytes) {
        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(multipartId)
                .partNumber(partNumber)
                .contentLength((long) bytes.length)
                .build();

        long start = System.currentTimeMillis();
        return retry.execute(() -> Uni.createFrom().completionStage(
                                () -> s3.uploadPart(request, AsyncRequestBody.fromBytes(bytes))),
                        "uploadPart " + key + "#" + partNumber)
                .map(response -> {
                    LOG.debugf("Uploaded part: key=%s, partNumber=%d, size=%d, duration=%dms, eTag=%s",
                            key, partNumber, bytes.length, System.currentTimeMillis() - start, response.eTag());
                    return response.eTag();
                })
                .onFailure().transform(e -> failure("uploadPart", key, e));
    }

    @Override
    public Uni<Void> completeMultipart(String key, String multipartId, List<CompletedPartRef> parts) {
        MultipartStorageClient.requireAscending(parts);

        List<CompletedPart> completedParts = parts.stream()
                .map(part -> CompletedPart.builder()
                        .partNumber(part.partNumber())
                        .eTag(part.eTag())
                        .build())
                .toList();

        CompleteMultipartUploadRequest request = CompleteMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(multipartId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(completedParts).build())
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.completeMultipartUpload(request)),
                        "completeMultipart " + key)
                .invoke(response -> LOG.debugf("Completed multipart upload: key=%s, parts=%d, eTag=%s",
                        key, parts.size(), response.eTag()))
                .replaceWithVoid()
                .onFailure(S3MultipartStorageClient::isNoSuchUpload).recoverWithUni(error ->
                        // the upload id is gone: either aborted or already completed by an earlier attempt
                        objectExists(key).onItem().transformToUni(exists -> {
                            if (exists) {
                                LOG.infof("Multipart upload %s for key=%s was already completed", multipartId, key);
                                return Uni.createFrom().voidItem();
                            }
                            return Uni.createFrom().failure(error);
                        }))
                .onFailure().transform(e -> failure("completeMultipart", key, e));
    }

    @Override
    public Uni<Void> abortMultipart(String key, String multipartId) {
        AbortMultipartUploadRequest request = AbortMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(multipartId)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.abortMultipartUpload(request)),
                        "abortMultipart " + key)
                .invoke(() -> LOG.debugf("Aborted multipart upload: key=%s, uploadId=%s", key, multipartId))
                .replaceWithVoid()
                .onFailure().recoverWithItem(e -> {
                    LOG.warnf("Failed to abort multipart upload: key=%s, uploadId=%s: %s", key, multipartId, e.getMessage());
                    return null;
                });
    }

    @Override
    public Uni<Long> headObject(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.headObject(request)),
                        "headObject " + key)
                .map(response -> response.contentLength())
                .onFailure().transform(e -> failure("headObject", key, e));
    }

    @Override
    public Uni<byte[]> getRange(String key, long start, long endInclusive) {
        if (start < 0 || endInclusive < start) {
            throw new IllegalArgumentException(String.format("Invalid range [%d, %d]", start, endInclusive));
        }
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .range("bytes=" + start + "-" + endInclusive)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(
                                () -> s3.getObject(request, AsyncResponseTransformer.<GetObjectResponse>toBytes())),
                        "getRange " + key)
                .map(ResponseBytes::asByteArray)
                .onFailure().transform(e -> failure("getRange", key, e));
    }

    @Override
    public Uni<byte[]> getObject(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(
                                () -> s3.getObject(request, AsyncResponseTransformer.<GetObjectResponse>toBytes())),
                        "getObject " + key)
                .map(ResponseBytes::asByteArray)
                .onFailure().transform(e -> failure("getObject", key, e));
    }

    @Override
    public Uni<Void> deleteObject(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.deleteObject(request)),
                        "deleteObject " + key)
                .invoke(() -> LOG.debugf("Deleted object: key=%s", key))
                .replaceWithVoid()
                .onFailure().transform(e -> failure("deleteObject", key, e));
    }

    private Uni<Boolean> objectExists(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return retry.execute(() -> Uni.createFrom().completionStage(() -> s3.headObject(request)),
                        "headObject " + key)
                .map(response -> Boolean.TRUE)
                .onFailure(S3MultipartStorageClient::isNotFound).recoverWithItem(Boolean.FALSE);
    }

    private static StorageCallException failure(String operation, String key, Throwable error) {
        if (!(error instanceof StorageCallException)) {
            LOG.errorf("Object store call failed: operation=%s, key=%s: %s", operation, key, error.getMessage());
        }
        return StorageCallException.of(operation, key, error);
    }

    static boolean isNoSuchUpload(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof NoSuchUploadException) {
                return true;
            }
            if (t instanceof S3Exception s3Error && s3Error.awsErrorDetails() != null
                    && "NoSuchUpload".equals(s3Error.awsErrorDetails().errorCode())) {
                return true;
            }
        }
        return false;
    }

    static boolean isNotFound(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof NoSuchKeyException) {
                return true;
            }
            if (t instanceof SdkServiceException service && service.statusCode() == 404) {
                return true;
            }
        }
        return false;
    }
}
