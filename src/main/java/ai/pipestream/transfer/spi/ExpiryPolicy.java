package ai.pipestream.transfer.spi;

import java.time.Instant;

/**
 * Decides how long a published archive is kept.
 */
public interface ExpiryPolicy {

    Instant expiresAt(Instant publishedAt);
}
