package ai.pipestream.transfer.spi;

import ai.pipestream.transfer.config.TransferConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps every archive for a fixed retention period.
 */
@ApplicationScoped
public class RetentionExpiryPolicy implements ExpiryPolicy {

    private final Duration retention;

    @Inject
    public RetentionExpiryPolicy(TransferConfiguration config) {
        this(config.expiry().retention());
    }

    public RetentionExpiryPolicy(Duration retention) {
        this.retention = retention;
    }

    @Override
    public Instant expiresAt(Instant publishedAt) {
        return publishedAt.plus(retention);
    }
}
