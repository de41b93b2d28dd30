package ai.pipestream.transfer.exception;

/**
 * Thrown when repacking or publishing the archive failed. The builder has already
 * aborted its own multipart upload when this reaches the caller.
 */
public class ArchiveBuildException extends TransferServiceException {

    public ArchiveBuildException(String sessionId, String message) {
        super("BUILDER_FAILURE", "archive",
            String.format("Archive build failed for session %s: %s", sessionId, message));
    }

    public ArchiveBuildException(String sessionId, String message, Throwable cause) {
        super("BUILDER_FAILURE", "archive",
            String.format("Archive build failed for session %s: %s", sessionId, message), cause);
    }

    public static ArchiveBuildException failed(String sessionId, Throwable cause) {
        if (cause instanceof ArchiveBuildException existing) {
            return existing;
        }
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ArchiveBuildException(sessionId, reason, cause);
    }

    public static ArchiveBuildException finalizeTimedOut(String sessionId, long pendingParts, java.time.Duration timeout) {
        return new ArchiveBuildException(sessionId,
            String.format("%d part upload(s) still pending after %s", pendingParts, timeout));
    }
}
