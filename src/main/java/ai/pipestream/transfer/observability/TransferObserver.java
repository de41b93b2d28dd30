package ai.pipestream.transfer.observability;

import java.time.Duration;

/**
 * Receives lifecycle events from the transfer pipeline.
 * Every method defaults to a no-op so implementations only override what they record.
 */
public interface TransferObserver {

    TransferObserver NOOP = new TransferObserver() {
    };

    /**
     * A failed attempt will be retried after {@code delay}.
     *
     * @param attempt the 1-indexed attempt that just failed
     */
    default void retryScheduled(String label, int attempt, Duration delay, Throwable error) {
    }

    default void sessionInitiated(String sessionId, int fileCount, long totalChunks) {
    }

    default void chunkConfirmed(String sessionId, boolean isNew) {
    }

    default void sessionSealed(String sessionId) {
    }

    default void partUploaded(String key, int partNumber, long bytes) {
    }

    default void archiveCompleted(String sessionId, long bytes, Duration elapsed) {
    }

    default void archiveFailed(String sessionId, Throwable error) {
    }
}
