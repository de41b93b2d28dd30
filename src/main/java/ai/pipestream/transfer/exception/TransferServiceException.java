package ai.pipestream.transfer.exception;

/**
 * Base exception for all Transfer Service operations.
 * Carries a stable error code and the operation that failed so the HTTP layer can map it.
 */
public class TransferServiceException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public TransferServiceException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public TransferServiceException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
