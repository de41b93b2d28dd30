package ai.pipestream.transfer.archive;

import java.time.Instant;

/**
 * Metadata of a published archive, read by the download layer.
 *
 * @param credentialHash hash of the credential that protects the download
 */
public record ArchiveRecord(String archiveId,
                            String storageKey,
                            String fileName,
                            long sizeBytes,
                            int fileCount,
                            String credentialHash,
                            Instant createdAt,
                            Instant expiresAt) {
}
