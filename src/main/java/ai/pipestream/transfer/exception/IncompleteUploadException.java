package ai.pipestream.transfer.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when seal is attempted before every chunk of every file was confirmed.
 * The session stays ingesting; the caller uploads the missing chunks and retries.
 */
public class IncompleteUploadException extends TransferServiceException {

    private final String sessionId;
    private final Map<String, List<Integer>> missingChunks;

    public IncompleteUploadException(String sessionId, Map<String, List<Integer>> missingChunks) {
        super("INCOMPLETE", "seal", describe(missingChunks));
        this.sessionId = sessionId;
        this.missingChunks = Collections.unmodifiableMap(new LinkedHashMap<>(missingChunks));
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Missing chunk indices keyed by file name, in session file order.
     */
    public Map<String, List<Integer>> getMissingChunks() {
        return missingChunks;
    }

    private static String describe(Map<String, List<Integer>> missing) {
        return missing.entrySet().stream()
            .map(e -> String.format("file %s is missing %d chunk(s) %s",
                e.getKey(), e.getValue().size(), abbreviate(e.getValue())))
            .collect(Collectors.joining("; "));
    }

    private static String abbreviate(List<Integer> indices) {
        if (indices.size() <= 20) {
            return indices.toString();
        }
        return indices.subList(0, 20).toString().replace("]", ", ...]");
    }
}
