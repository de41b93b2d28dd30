package ai.pipestream.transfer.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;

/**
 * Metrics for the transfer pipeline.
 * Exposes counters, timers, and histograms via Micrometer.
 */
@ApplicationScoped
public class TransferMetrics implements TransferObserver {

    @Inject
    MeterRegistry registry;

    private Counter sessionInitiatedTotal;
    private Counter chunkConfirmedTotal;
    private Counter chunkIdempotentHitTotal;
    private Counter sessionSealedTotal;
    private Counter archiveFailedTotal;

    private Timer archiveBuildLatency;

    private DistributionSummary archivePartBytes;
    private DistributionSummary archiveSizeBytes;

    @PostConstruct
    void init() {
        sessionInitiatedTotal = Counter.builder("transfer_session_initiated_total")
                .description("Total number of upload sessions initiated")
                .register(registry);

        chunkConfirmedTotal = Counter.builder("transfer_chunk_confirmed_total")
                .description("Total number of chunks confirmed for the first time")
                .register(registry);

        chunkIdempotentHitTotal = Counter.builder("transfer_chunk_idempotent_hit_total")
                .description("Total number of repeated chunk confirmations")
                .register(registry);

        sessionSealedTotal = Counter.builder("transfer_session_sealed_total")
                .description("Total number of sessions whose sources were sealed")
                .register(registry);

        archiveFailedTotal = Counter.builder("transfer_archive_failed_total")
                .description("Total number of archive builds that failed")
                .register(registry);

        archiveBuildLatency = Timer.builder("transfer_archive_build_latency_ms")
                .description("Wall time of a complete archive build")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        archivePartBytes = DistributionSummary.builder("transfer_archive_part_bytes")
                .description("Distribution of archive part sizes in bytes")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        archiveSizeBytes = DistributionSummary.builder("transfer_archive_size_bytes")
                .description("Distribution of published archive sizes in bytes")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    @Override
    public void retryScheduled(String label, int attempt, Duration delay, Throwable error) {
        // label carries object keys, keep it out of the tags
        registry.counter("transfer_retry_scheduled_total",
                "error", error.getClass().getSimpleName()).increment();
    }

    @Override
    public void sessionInitiated(String sessionId, int fileCount, long totalChunks) {
        sessionInitiatedTotal.increment();
    }

    @Override
    public void chunkConfirmed(String sessionId, boolean isNew) {
        if (isNew) {
            chunkConfirmedTotal.increment();
        } else {
            chunkIdempotentHitTotal.increment();
        }
    }

    @Override
    public void sessionSealed(String sessionId) {
        sessionSealedTotal.increment();
    }

    @Override
    public void partUploaded(String key, int partNumber, long bytes) {
        archivePartBytes.record(bytes);
    }

    @Override
    public void archiveCompleted(String sessionId, long bytes, Duration elapsed) {
        archiveBuildLatency.record(elapsed);
        archiveSizeBytes.record(bytes);
    }

    @Override
    public void archiveFailed(String sessionId, Throwable error) {
        archiveFailedTotal.increment();
    }
}
