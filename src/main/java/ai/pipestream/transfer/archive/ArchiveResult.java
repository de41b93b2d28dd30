package ai.pipestream.transfer.archive;

/**
 * A published archive.
 */
public record ArchiveResult(String archiveId, String storageKey, String fileName, long sizeBytes, int fileCount, int partCount) {
}
