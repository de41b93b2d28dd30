package ai.pipestream.transfer.retry;

import ai.pipestream.transfer.config.TransferConfiguration;

import java.time.Duration;

/**
 * Backoff parameters: the delay after failed attempt k is {@code baseDelay * 2^(k-1)} plus a
 * uniform random value in {@code [0, jitter)}.
 */
public record RetrySettings(int maxAttempts, Duration baseDelay, Duration jitter) {

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (jitter == null || jitter.isNegative()) {
            throw new IllegalArgumentException("jitter must be zero or positive");
        }
    }

    public static RetrySettings from(TransferConfiguration.Retry config) {
        return new RetrySettings(config.maxAttempts(), config.baseDelay(), config.jitter());
    }

    public static RetrySettings defaults() {
        return new RetrySettings(5, Duration.ofSeconds(1), Duration.ofSeconds(1));
    }
}
