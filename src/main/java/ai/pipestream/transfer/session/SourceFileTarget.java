package ai.pipestream.transfer.session;

/**
 * One declared source file and the multipart upload its chunks go to.
 *
 * @param storageKey      object key of the temporary source object
 * @param totalChunks     {@code max(1, ceil(declaredSize / chunkSize))}
 * @param remoteCompleted set once the source multipart upload was completed
 */
public record SourceFileTarget(String name,
                               long declaredSize,
                               String storageKey,
                               String multipartId,
                               long chunkSize,
                               int totalChunks,
                               boolean remoteCompleted) {

    public SourceFileTarget {
        if (totalChunks < 1) {
            throw new IllegalArgumentException("totalChunks must be at least 1 for " + name);
        }
    }

    /**
     * Chunks needed for a declared size. Returned as a long; callers check the part limit before narrowing.
     */
    public static long chunkCount(long declaredSize, long chunkSize) {
        if (declaredSize <= 0) {
            return 1L;
        }
        return declaredSize / chunkSize + (declaredSize % chunkSize == 0 ? 0 : 1);
    }

    public SourceFileTarget withRemoteCompleted() {
        return new SourceFileTarget(name, declaredSize, storageKey, multipartId, chunkSize, totalChunks, true);
    }
}
