package ai.pipestream.transfer.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the transfer pipeline.
 * All keys are namespaced under {@code transfer.*}; object store keys live in {@link S3Config}.
 */
@ConfigMapping(prefix = "transfer")
public interface TransferConfiguration {

    Upload upload();

    Retry retry();

    Archive archive();

    Metadata metadata();

    Expiry expiry();

    interface Upload {
        /**
         * Size of every client chunk except the last one of a file.
         * Default: 5 MiB.
         */
        @WithDefault("5242880")
        long chunkSize();

        /**
         * Maximum number of files a single session may declare.
         * Default: 100.
         */
        @WithDefault("100")
        int maxFiles();

        /**
         * Number of parallel workers used by the chunk uploader.
         * Default: 3.
         */
        @WithDefault("3")
        int clientConcurrency();

        /**
         * Per-request timeout of a single chunk PUT.
         * Default: 180 seconds.
         */
        @WithDefault("PT180S")
        Duration requestTimeout();
    }

    interface Retry {
        @WithDefault("5")
        int maxAttempts();

        @WithDefault("PT1S")
        Duration baseDelay();

        /**
         * Upper bound (exclusive) of the random delay added to every backoff.
         */
        @WithDefault("PT1S")
        Duration jitter();
    }

    interface Archive {
        /**
         * Exact size of every archive part except the last.
         * Default: 50 MiB.
         */
        @WithDefault("52428800")
        long standardPartSize();

        /**
         * Object store minimum for non-final multipart parts.
         * Default: 5 MiB.
         */
        @WithDefault("5242880")
        long minPartSize();

        /**
         * Size of a single ranged read of a source object.
         * Default: 10 MiB.
         */
        @WithDefault("10485760")
        int readWindow();

        /**
         * Number of slices the producer may queue ahead of the part consumer.
         */
        @WithDefault("16")
        int channelCapacity();

        @WithDefault("1048576")
        int sliceSize();

        /**
         * Upper bound for waiting on outstanding part uploads after the archive was written.
         */
        @WithDefault("PT60S")
        Duration finalizeTimeout();

        @WithDefault("files.zip")
        String archiveName();
    }

    interface Metadata {
        @WithDefault("1000000")
        long maxEntries();

        @WithDefault("P31D")
        Duration ttl();

        /**
         * Page size used when listing chunk records.
         */
        @WithDefault("1000")
        int pageSize();
    }

    interface Expiry {
        /**
         * How long a published archive stays downloadable.
         * Default: 30 days.
         */
        @WithDefault("P30D")
        Duration retention();
    }
}
