package ai.pipestream.transfer.exception;

/**
 * Thrown by init when the access credential is missing or malformed.
 */
public class InvalidCredentialException extends InvalidRequestException {

    public InvalidCredentialException(String operation) {
        super("INVALID_CREDENTIAL", operation, "credential is missing or malformed", true);
    }
}
