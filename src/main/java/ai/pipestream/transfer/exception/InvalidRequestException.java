package ai.pipestream.transfer.exception;

/**
 * Thrown when request validation fails. Never retried.
 */
public class InvalidRequestException extends TransferServiceException {

    public InvalidRequestException(String operation, String field, String reason) {
        super("INVALID_REQUEST", operation,
            String.format("Invalid %s: %s", field, reason));
    }

    protected InvalidRequestException(String errorCode, String operation, String message, boolean unused) {
        super(errorCode, operation, message);
    }

    public static InvalidRequestException missingField(String operation, String fieldName) {
        return new InvalidRequestException(operation, fieldName, "field is required but missing");
    }

    public static InvalidRequestException invalidField(String operation, String fieldName, Object value, String reason) {
        return new InvalidRequestException(operation, fieldName,
            String.format("value '%s' is invalid: %s", value, reason));
    }
}
