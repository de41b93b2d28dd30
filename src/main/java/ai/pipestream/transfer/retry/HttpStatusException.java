package ai.pipestream.transfer.retry;

/**
 * Non-2xx answer from a plain HTTP call (for example a pre-signed part PUT).
 * The status drives retry classification.
 */
public class HttpStatusException extends RuntimeException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(String.format("HTTP %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
