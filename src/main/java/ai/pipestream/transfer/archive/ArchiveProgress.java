package ai.pipestream.transfer.archive;

/**
 * Progress of a running archive build, persisted so that any node can report it.
 */
public record ArchiveProgress(Phase phase, int processedFiles, int totalFiles, String currentFile) {

    public enum Phase {
        READING,
        FINALIZING
    }

    /**
     * Reading covers 0 to 80 percent, finalizing reports 90.
     */
    public int percent() {
        if (phase == Phase.FINALIZING) {
            return 90;
        }
        if (totalFiles == 0) {
            return 0;
        }
        return (int) ((long) processedFiles * 80 / totalFiles);
    }
}
