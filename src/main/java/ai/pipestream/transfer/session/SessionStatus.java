package ai.pipestream.transfer.session;

/**
 * Point-in-time view of a session, computed on demand.
 *
 * @param progressPercent ingest progress while INGESTING, archive progress afterwards
 * @param currentFile     file being archived, while ARCHIVING
 */
public record SessionStatus(SessionState state,
                            int progressPercent,
                            long uploadedCount,
                            long totalChunks,
                            String archiveId,
                            String error,
                            String currentFile) {
}
