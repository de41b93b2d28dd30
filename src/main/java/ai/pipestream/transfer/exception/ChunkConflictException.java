package ai.pipestream.transfer.exception;

/**
 * Thrown when a chunk that was already confirmed is confirmed again with a different ETag.
 * The ledger never overwrites; the session is failed.
 */
public class ChunkConflictException extends TransferServiceException {

    public ChunkConflictException(String sessionId, String fileName, int chunkIndex, String recorded, String offered) {
        super("REMOTE_INCONSISTENCY", "confirmChunk",
            String.format("chunk %d of %s in session %s was confirmed with ETag %s, got %s",
                chunkIndex, fileName, sessionId, recorded, offered));
    }
}
