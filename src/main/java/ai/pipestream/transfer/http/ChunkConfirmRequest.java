package ai.pipestream.transfer.http;

/**
 * Body of a chunk confirmation. Numbers are boxed so that absent fields can be reported.
 */
public record ChunkConfirmRequest(String sessionId, String fileName, Integer chunkIndex, Integer partNumber, String eTag) {
}
