package ai.pipestream.transfer.session;

import ai.pipestream.transfer.config.S3Config;
import ai.pipestream.transfer.config.TransferConfiguration;

/**
 * Session limits and the object key layout of source files.
 */
public record SessionSettings(String tempPrefix, long chunkSize, int maxFiles) {

    /**
     * Multipart uploads allow at most this many parts.
     */
    public static final int MAX_PARTS = 10_000;

    public SessionSettings {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be positive, got " + maxFiles);
        }
    }

    public static SessionSettings from(S3Config s3, TransferConfiguration.Upload upload) {
        return new SessionSettings(s3.tempPrefix(), upload.chunkSize(), upload.maxFiles());
    }

    public String sourceKey(String sessionId, String fileName) {
        return tempPrefix + "/" + sessionId + "/" + fileName;
    }
}
