package ai.pipestream.transfer.exception;

public class SessionNotFoundException extends TransferServiceException {

    public SessionNotFoundException(String operation, String sessionId) {
        super("NOT_FOUND", operation, "Upload session not found: " + sessionId);
    }

    public static SessionNotFoundException fileNotInSession(String operation, String sessionId, String fileName) {
        return new SessionNotFoundException(operation, sessionId + " (file " + fileName + ")");
    }
}
