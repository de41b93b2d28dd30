package ai.pipestream.transfer.archive;

/**
 * A sealed source object and the entry name it gets in the archive.
 */
public record ArchiveSource(String name, String storageKey) {
}
