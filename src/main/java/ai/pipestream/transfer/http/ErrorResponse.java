package ai.pipestream.transfer.http;

import java.util.List;
import java.util.Map;

/**
 * JSON error body.
 *
 * @param missingChunks missing chunk indices per file, only for incomplete uploads
 */
public record ErrorResponse(String code, String operation, String message, Map<String, List<Integer>> missingChunks) {
}
