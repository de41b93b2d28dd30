package ai.pipestream.transfer.archive;

import java.time.Instant;
import java.util.List;

/**
 * Input of one archive build.
 *
 * @param entryTime   modification time stamped on every entry
 * @param passthrough republish the single source byte for byte instead of packing it
 */
public record ArchiveJob(String sessionId, String archiveId, List<ArchiveSource> sources, Instant entryTime, boolean passthrough) {

    public ArchiveJob {
        sources = List.copyOf(sources);
        if (passthrough && sources.size() != 1) {
            throw new IllegalArgumentException("passthrough requires exactly one source, got " + sources.size());
        }
    }
}
