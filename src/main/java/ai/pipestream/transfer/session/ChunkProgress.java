package ai.pipestream.transfer.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ingest progress reported after a chunk confirmation.
 *
 * @param newChunk false when the chunk had already been confirmed
 */
public record ChunkProgress(long uploadedCount,
                            long totalChunks,
                            @JsonProperty("isNew") boolean newChunk,
                            int progressPercent) {
}
