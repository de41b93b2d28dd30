package ai.pipestream.transfer.retry;

import ai.pipestream.transfer.config.TransferConfiguration;
import ai.pipestream.transfer.exception.StorageCallException;
import ai.pipestream.transfer.observability.TransferObserver;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs remote operations with exponential backoff and jitter.
 * <p>
 * Only transient failures are retried: a small set of HTTP status codes and network-level
 * errors recognised by type or message. Everything else fails on the first attempt. When the
 * attempts are exhausted the last error is propagated unchanged.
 */
@ApplicationScoped
public class RetryPolicy {

    private static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504, 599);

    static final List<String> RETRYABLE_MESSAGE_PATTERNS = List.of(
            "network",
            "timeout",
            "timed out",
            "econnreset",
            "etimedout",
            "connection lost",
            "connection closed",
            "connection reset",
            "connection refused",
            "socket hang up",
            "enotfound",
            "econnrefused",
            "unknownhost",
            "unknown host",
            "fetch failed",
            "failed to fetch",
            "network request failed",
            "aborted",
            "request aborted",
            "protocol error",
            "err_http2");

    private final RetrySettings settings;
    private final TransferObserver observer;

    @Inject
    public RetryPolicy(TransferConfiguration config, TransferObserver observer) {
        this(RetrySettings.from(config.retry()), observer);
    }

    public RetryPolicy(RetrySettings settings, TransferObserver observer) {
        this.settings = settings;
        this.observer = observer != null ? observer : TransferObserver.NOOP;
    }

    public RetrySettings settings() {
        return settings;
    }

    /**
     * Executes the operation with the configured number of attempts.
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation, String label) {
        return execute(operation, settings.maxAttempts(), label);
    }

    /**
     * Executes the operation, subscribing to a fresh {@link Uni} from the supplier on every attempt.
     *
     * @param operation   supplies the remote call; invoked once per attempt
     * @param maxAttempts total attempts including the first one
     * @param label       short description used in logs and retry events
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation, int maxAttempts, String label) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        return attempt(operation, 1, maxAttempts, label);
    }

    private <T> Uni<T> attempt(Supplier<Uni<T>> operation, int attempt, int maxAttempts, String label) {
        return Uni.createFrom().deferred(() -> operation.get())
                .onFailure().recoverWithUni(error -> {
                    if (!isRetryable(error)) {
                        return Uni.createFrom().failure(error);
                    }
                    if (attempt >= maxAttempts) {
                        LOG.errorf("%s failed after %d attempt(s): %s", label, attempt, error.getMessage());
                        return Uni.createFrom().failure(error);
                    }
                    Duration delay = delayFor(attempt);
                    LOG.warnf("%s failed (attempt %d/%d), retrying in %d ms: %s",
                            label, attempt, maxAttempts, delay.toMillis(), error.getMessage());
                    observer.retryScheduled(label, attempt, delay, error);

                    Uni<T> next = attempt(operation, attempt + 1, maxAttempts, label);
                    if (delay.isZero()) {
                        return next;
                    }
                    return Uni.createFrom().voidItem()
                            .onItem().delayIt().by(delay)
                            .onItem().transformToUni(ignored -> next);
                });
    }

    /**
     * Backoff for the given failed attempt (1-indexed).
     */
    Duration delayFor(int attempt) {
        long base = settings.baseDelay().toMillis() * (1L << Math.min(attempt - 1, 20));
        long jitterBound = settings.jitter().toMillis();
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0L;
        return Duration.ofMillis(base + jitter);
    }

    /**
     * Decides whether an error is transient. Walks the cause chain; an element is transient when
     * its HTTP status is retryable, its type is a timeout or connect failure, or its message matches.
     */
    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            Integer status = statusOf(current);
            if (status != null && RETRYABLE_STATUS_CODES.contains(status)) {
                return true;
            }
            if (current instanceof TimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException) {
                return true;
            }
            if (matchesPattern(current.getMessage())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static Integer statusOf(Throwable error) {
        if (error instanceof SdkServiceException service && service.statusCode() > 0) {
            return service.statusCode();
        }
        if (error instanceof StorageCallException storage) {
            return storage.getStatusCode();
        }
        if (error instanceof HttpStatusException http) {
            return http.getStatusCode();
        }
        return null;
    }

    private static boolean matchesPattern(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : RETRYABLE_MESSAGE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
