package ai.pipestream.transfer.metadata;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Key layout of the metadata store.
 * File names are URL-encoded so that a {@code :} inside a name cannot collide with the separators.
 */
public final class MetadataKeys {

    private static final String UPLOAD = "upload:";
    private static final String ARCHIVE = "archive:";

    private MetadataKeys() {
    }

    public static String session(String sessionId) {
        return UPLOAD + sessionId;
    }

    public static String uploadedCount(String sessionId) {
        return UPLOAD + sessionId + ":count";
    }

    public static String chunk(String sessionId, String fileName, int chunkIndex) {
        return chunkPrefix(sessionId, fileName) + chunkIndex;
    }

    /**
     * Prefix shared by every chunk record of one file, including the trailing separator.
     */
    public static String chunkPrefix(String sessionId, String fileName) {
        return chunkPrefix(sessionId) + encode(fileName) + ":";
    }

    public static String chunkPrefix(String sessionId) {
        return UPLOAD + sessionId + ":chunk:";
    }

    public static String archiveProgress(String sessionId) {
        return UPLOAD + sessionId + ":archive";
    }

    public static String archive(String archiveId) {
        return ARCHIVE + archiveId;
    }

    static String encode(String fileName) {
        return URLEncoder.encode(fileName, StandardCharsets.UTF_8);
    }
}
