package ai.pipestream.transfer.http;

public record CompleteUploadRequest(String sessionId) {
}
