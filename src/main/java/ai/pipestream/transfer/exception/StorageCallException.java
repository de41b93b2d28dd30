package ai.pipestream.transfer.exception;

import software.amazon.awssdk.core.exception.SdkServiceException;

import java.util.concurrent.CompletionException;

/**
 * Thrown when an object-store call fails after the retry policy gave up.
 * Keeps the HTTP status of the underlying provider error when one is known.
 */
public class StorageCallException extends TransferServiceException {

    private final String key;
    private final Integer statusCode;

    public StorageCallException(String operation, String key, Integer statusCode, String details) {
        super("STORAGE_ERROR", operation,
            String.format("Object store call failed: key=%s, status=%s, details=%s", key, statusCode, details));
        this.key = key;
        this.statusCode = statusCode;
    }

    public StorageCallException(String operation, String key, Throwable cause) {
        super("STORAGE_ERROR", operation,
            String.format("Object store call failed: key=%s, status=%s", key, statusOf(cause)), unwrap(cause));
        this.key = key;
        this.statusCode = statusOf(cause);
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the provider HTTP status, or null when the failure never reached the provider
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public static StorageCallException of(String operation, String key, Throwable cause) {
        if (cause instanceof StorageCallException existing) {
            return existing;
        }
        return new StorageCallException(operation, key, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Integer statusOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SdkServiceException service) {
                return service.statusCode();
            }
            if (t instanceof StorageCallException storage && storage.statusCode != null) {
                return storage.statusCode;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
