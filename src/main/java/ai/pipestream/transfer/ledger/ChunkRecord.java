package ai.pipestream.transfer.ledger;

import java.time.Instant;

/**
 * Confirmation of one chunk uploaded by the client. Written once, never overwritten.
 *
 * @param partNumber always {@code chunkIndex + 1}
 * @param eTag       ETag returned by the object store for the part, as reported by the client
 */
public record ChunkRecord(String fileName, int chunkIndex, int partNumber, String eTag, Instant confirmedAt) {
}
