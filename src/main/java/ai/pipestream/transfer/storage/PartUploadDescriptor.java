package ai.pipestream.transfer.storage;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Pre-authorized, time-boxed permission for a client to PUT one part directly to the object store.
 *
 * @param partNumber    1-based part number
 * @param url           pre-signed URL
 * @param signedHeaders headers the client must send with the PUT
 * @param expiresAt     when the URL stops being accepted
 */
public record PartUploadDescriptor(int partNumber, String url, Map<String, List<String>> signedHeaders, Instant expiresAt) {
}
