package ai.pipestream.transfer.client;

import ai.pipestream.transfer.storage.PartUploadDescriptor;
import io.smallrye.mutiny.Uni;

/**
 * Sends one chunk to its pre-authorized part URL.
 */
public interface PartTransport {

    /**
     * @return the ETag the object store assigned to the part
     */
    Uni<String> put(PartUploadDescriptor descriptor, byte[] bytes);
}
