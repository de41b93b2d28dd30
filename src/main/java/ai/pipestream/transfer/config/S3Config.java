package ai.pipestream.transfer.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Object store configuration.
 *
 * Clients upload chunks straight to the bucket through pre-signed part URLs; the service itself
 * only issues control calls and the server-side archive parts.
 */
@ConfigMapping(prefix = "transfer.s3")
public interface S3Config {

    String endpoint();

    String region();

    String accessKey();

    String secretKey();

    String bucket();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("true")
    boolean pathStyleAccess();

    /**
     * Key prefix for the per-session source objects.
     */
    @WithDefault("temp")
    String tempPrefix();

    /**
     * Key prefix for published archives.
     */
    @WithDefault("archives")
    String archivePrefix();

    /**
     * Total time allowed for one SDK call.
     */
    @WithDefault("PT60S")
    Duration callTimeout();

    @WithDefault("PT30S")
    Duration callAttemptTimeout();

    /**
     * Lifetime of a pre-signed part upload URL.
     */
    @WithDefault("PT1H")
    Duration presignTtl();
}
