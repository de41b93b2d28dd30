package ai.pipestream.transfer.exception;

/**
 * Thrown by init when the request declares no files.
 */
public class NoFilesException extends InvalidRequestException {

    public NoFilesException(String operation) {
        super("NO_FILES", operation, "at least one file is required", true);
    }
}
