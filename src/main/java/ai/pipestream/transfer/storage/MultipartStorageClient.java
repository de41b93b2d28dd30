package ai.pipestream.transfer.storage;

import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Narrow view of an S3-compatible object store.
 * <p>
 * Every remote operation is retried on transient failures and bounded by a per-call timeout.
 * Failures surface as {@link ai.pipestream.transfer.exception.StorageCallException}.
 */
public interface MultipartStorageClient {

    /**
     * Starts a multipart upload.
     *
     * @return the provider's multipart upload id
     */
    Uni<String> createMultipart(String key);

    /**
     * Issues a pre-signed URL allowing a client to upload one part directly. No network round trip.
     */
    Uni<PartUploadDescriptor> authorizePartUpload(String key, String multipartId, int partNumber);

    /**
     * Uploads one part from the server side.
     *
     * @return the ETag assigned by the store
     */
    Uni<String> uploadPart(String key, String multipartId, int partNumber, byte[] bytes);

    /**
     * Completes a multipart upload. The parts must be listed in strictly ascending part number
     * order. Completing an upload that was already completed succeeds.
     *
     * @throws IllegalArgumentException if the parts are empty or not strictly ascending
     */
    Uni<Void> completeMultipart(String key, String multipartId, List<CompletedPartRef> parts);

    /**
     * Aborts a multipart upload. Best effort: failures are logged, never propagated.
     */
    Uni<Void> abortMultipart(String key, String multipartId);

    /**
     * @return the object size in bytes
     */
    Uni<Long> headObject(String key);

    /**
     * Reads the inclusive byte range {@code [start, endInclusive]}.
     */
    Uni<byte[]> getRange(String key, long start, long endInclusive);

    Uni<byte[]> getObject(String key);

    Uni<Void> deleteObject(String key);

    /**
     * Checks that a part list is non-empty and strictly ascending by part number.
     */
    static void requireAscending(List<CompletedPartRef> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("At least one part is required to complete a multipart upload");
        }
        int previous = 0;
        for (CompletedPartRef part : parts) {
            if (part.partNumber() <= previous) {
                throw new IllegalArgumentException(String.format(
                        "Parts must be strictly ascending by part number: %d follows %d", part.partNumber(), previous));
            }
            previous = part.partNumber();
        }
    }
}
