package ai.pipestream.transfer.http;

import ai.pipestream.transfer.exception.ArchiveBuildException;
import ai.pipestream.transfer.exception.ChunkConflictException;
import ai.pipestream.transfer.exception.IncompleteUploadException;
import ai.pipestream.transfer.exception.InvalidRequestException;
import ai.pipestream.transfer.exception.InvalidStateException;
import ai.pipestream.transfer.exception.SessionNotFoundException;
import ai.pipestream.transfer.exception.StorageCallException;
import ai.pipestream.transfer.exception.TransferServiceException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps service exceptions to JSON error responses.
 */
@Provider
public class TransferExceptionMapper implements ExceptionMapper<TransferServiceException> {

    private static final Logger LOG = Logger.getLogger(TransferExceptionMapper.class);

    @Override
    public Response toResponse(TransferServiceException exception) {
        int status = statusFor(exception);
        if (status >= 500) {
            LOG.errorf(exception, "Request failed: %s", exception.getMessage());
        } else {
            LOG.debugf("Request rejected (%d): %s", status, exception.getMessage());
        }
        ErrorResponse body = new ErrorResponse(exception.getErrorCode(), exception.getOperation(), exception.getMessage(),
                exception instanceof IncompleteUploadException incomplete ? incomplete.getMissingChunks() : null);
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(body)
                .build();
    }

    static int statusFor(TransferServiceException exception) {
        if (exception instanceof InvalidRequestException) {
            return 400;
        }
        if (exception instanceof SessionNotFoundException) {
            return 404;
        }
        if (exception instanceof InvalidStateException
                || exception instanceof IncompleteUploadException
                || exception instanceof ChunkConflictException) {
            return 409;
        }
        if (exception instanceof StorageCallException || exception instanceof ArchiveBuildException) {
            return 502;
        }
        return 500;
    }
}
