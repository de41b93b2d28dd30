package ai.pipestream.transfer.http;

import ai.pipestream.transfer.exception.InvalidRequestException;
import ai.pipestream.transfer.session.ChunkProgress;
import ai.pipestream.transfer.session.CompletionStatus;
import ai.pipestream.transfer.session.SessionDescriptor;
import ai.pipestream.transfer.session.SessionStatus;
import ai.pipestream.transfer.session.UploadSessionManager;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

/**
 * Session endpoints. Chunk bytes never pass through here; clients PUT them to the pre-signed
 * part URLs returned by init and report each one back through {@code chunk/confirm}.
 */
@Path("/api/upload")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UploadResource {

    private static final Logger LOG = Logger.getLogger(UploadResource.class);

    @Inject
    UploadSessionManager manager;

    @POST
    @Path("/init")
    public Uni<SessionDescriptor> init(InitUploadRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingField("init", "body");
        }
        LOG.debugf("Init request: files=%d", request.files() != null ? request.files().size() : 0);
        return manager.init(request.files(), request.credential());
    }

    @POST
    @Path("/chunk/confirm")
    public Uni<ChunkProgress> confirmChunk(ChunkConfirmRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingField("confirmChunk", "body");
        }
        requireText("confirmChunk", "sessionId", request.sessionId());
        requireText("confirmChunk", "fileName", request.fileName());
        requireText("confirmChunk", "eTag", request.eTag());
        if (request.chunkIndex() == null) {
            throw InvalidRequestException.missingField("confirmChunk", "chunkIndex");
        }
        if (request.partNumber() == null) {
            throw InvalidRequestException.missingField("confirmChunk", "partNumber");
        }
        return manager.confirmChunk(request.sessionId(), request.fileName(), request.chunkIndex(),
                request.partNumber(), request.eTag());
    }

    @POST
    @Path("/complete")
    public Uni<CompletionStatus> complete(CompleteUploadRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingField("complete", "body");
        }
        requireText("complete", "sessionId", request.sessionId());
        LOG.infof("Completion requested: sessionId=%s", request.sessionId());
        return manager.complete(request.sessionId());
    }

    @GET
    @Path("/status/{sessionId}")
    public Uni<SessionStatus> status(@PathParam("sessionId") String sessionId) {
        return manager.status(sessionId);
    }

    private static void requireText(String operation, String field, String value) {
        if (value == null || value.isBlank()) {
            throw InvalidRequestException.missingField(operation, field);
        }
    }
}
