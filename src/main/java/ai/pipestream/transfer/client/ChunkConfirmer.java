package ai.pipestream.transfer.client;

import io.smallrye.mutiny.Uni;

/**
 * Reports an uploaded chunk back to the session owner.
 */
@FunctionalInterface
public interface ChunkConfirmer {

    Uni<?> confirm(String fileName, int chunkIndex, int partNumber, String eTag);
}
