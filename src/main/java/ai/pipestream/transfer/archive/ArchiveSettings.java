package ai.pipestream.transfer.archive;

import ai.pipestream.transfer.config.S3Config;
import ai.pipestream.transfer.config.TransferConfiguration;

import java.time.Duration;

/**
 * Part layout and buffering of the archive pipeline.
 *
 * @param standardPartSize exact size of every archive part except the last
 * @param minPartSize      object store minimum for non-final parts
 * @param readWindow       bytes fetched per ranged read of a source
 * @param channelCapacity  slices the producer may queue ahead of the assembler
 * @param sliceSize        bytes per slice handed from the ZIP writer to the assembler
 * @param finalizeTimeout  bound on waiting for outstanding part uploads
 */
public record ArchiveSettings(String archivePrefix,
                              String archiveName,
                              long standardPartSize,
                              long minPartSize,
                              int readWindow,
                              int channelCapacity,
                              int sliceSize,
                              Duration finalizeTimeout) {

    public ArchiveSettings {
        if (minPartSize < 1) {
            throw new IllegalArgumentException("minPartSize must be positive, got " + minPartSize);
        }
        if (standardPartSize < minPartSize) {
            throw new IllegalArgumentException(String.format(
                    "standardPartSize (%d) must not be below minPartSize (%d)", standardPartSize, minPartSize));
        }
        if (standardPartSize > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("standardPartSize must fit in a single buffer, got " + standardPartSize);
        }
        if (readWindow < 1) {
            throw new IllegalArgumentException("readWindow must be positive, got " + readWindow);
        }
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("channelCapacity must be positive, got " + channelCapacity);
        }
        if (sliceSize < 1) {
            throw new IllegalArgumentException("sliceSize must be positive, got " + sliceSize);
        }
        if (finalizeTimeout == null || finalizeTimeout.isZero() || finalizeTimeout.isNegative()) {
            throw new IllegalArgumentException("finalizeTimeout must be positive");
        }
    }

    public static ArchiveSettings from(S3Config s3, TransferConfiguration.Archive archive) {
        return new ArchiveSettings(s3.archivePrefix(), archive.archiveName(), archive.standardPartSize(),
                archive.minPartSize(), archive.readWindow(), archive.channelCapacity(), archive.sliceSize(),
                archive.finalizeTimeout());
    }

    public String archiveKey(String archiveId) {
        return archivePrefix + "/" + archiveId;
    }
}
