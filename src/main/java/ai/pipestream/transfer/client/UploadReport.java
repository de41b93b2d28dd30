package ai.pipestream.transfer.client;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a client upload run.
 *
 * @param confirmed chunk indices uploaded and confirmed, per file
 * @param failed    chunk indices that could not be uploaded or confirmed, per file
 * @param cancelled whether the run was cancelled before every chunk was claimed
 */
public record UploadReport(Map<String, List<Integer>> confirmed, Map<String, List<Integer>> failed, boolean cancelled) {

    public boolean isComplete() {
        return failed.isEmpty() && !cancelled;
    }

    public int confirmedCount() {
        return confirmed.values().stream().mapToInt(List::size).sum();
    }
}
