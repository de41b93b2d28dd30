package ai.pipestream.transfer.session;

import java.util.List;

/**
 * Result of init, everything the client needs to upload its chunks.
 */
public record SessionDescriptor(String sessionId, long chunkSize, boolean passthrough, List<FileUploadPlan> files) {
}
