package ai.pipestream.transfer.session;

/**
 * Outcome of an explicit completion request.
 *
 * @param archiveId present once the archive was published
 */
public record CompletionStatus(SessionState state, String archiveId) {
}
