package ai.pipestream.transfer.metadata;

import ai.pipestream.transfer.config.TransferConfiguration;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory metadata store with bounded size and TTL-based eviction.
 * Atomic operations go through the cache's map view, which locks per key.
 */
@ApplicationScoped
public class InMemoryMetadataStore implements MetadataStore {

    private static final Logger LOG = Logger.getLogger(InMemoryMetadataStore.class);

    private final Cache<String, String> cache;
    private final ConcurrentMap<String, String> map;
    private final AtomicLong evictedTotal = new AtomicLong(0);

    @Inject
    public InMemoryMetadataStore(TransferConfiguration config, MeterRegistry meterRegistry) {
        this(config.metadata().maxEntries(), config.metadata().ttl(), meterRegistry);
    }

    public InMemoryMetadataStore(long maxEntries, Duration ttl, MeterRegistry meterRegistry) {
        RemovalListener<String, String> removalListener = notification -> {
            if (notification.wasEvicted()) {
                evictedTotal.incrementAndGet();
                LOG.debugf("Metadata entry evicted: key=%s, reason=%s", notification.getKey(), notification.getCause());
            }
        };

        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .removalListener(removalListener)
                .recordStats()
                .build();
        this.map = cache.asMap();

        if (meterRegistry != null) {
            GuavaCacheMetrics.monitor(meterRegistry, cache, "transfer_metadata");
            meterRegistry.gauge("transfer_metadata_evicted_total", evictedTotal, AtomicLong::get);
        }

        LOG.infof("InMemoryMetadataStore initialized: maxEntries=%d, ttl=%s", maxEntries, ttl);
    }

    @Override
    public Uni<String> get(String key) {
        return Uni.createFrom().item(() -> cache.getIfPresent(key));
    }

    @Override
    public Uni<Void> put(String key, String value) {
        return Uni.createFrom().item(() -> {
            cache.put(key, Objects.requireNonNull(value, "value"));
            return null;
        });
    }

    @Override
    public Uni<String> putIfAbsent(String key, String value) {
        return Uni.createFrom().item(() -> map.putIfAbsent(key, Objects.requireNonNull(value, "value")));
    }

    @Override
    public Uni<Boolean> replace(String key, String expected, String value) {
        return Uni.createFrom().item(() -> map.replace(key, expected, Objects.requireNonNull(value, "value")));
    }

    @Override
    public Uni<Long> increment(String key, long delta) {
        return Uni.createFrom().item(() -> {
            String updated = map.merge(key, Long.toString(delta),
                    (current, ignored) -> Long.toString(Long.parseLong(current) + delta));
            return Long.parseLong(updated);
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            cache.invalidate(key);
            return null;
        });
    }

    @Override
    public Uni<KeyPage> list(String prefix, String cursor, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return Uni.createFrom().item(() -> {
            List<String> matching = map.keySet().stream()
                    .filter(key -> key.startsWith(prefix))
                    .filter(key -> cursor == null || key.compareTo(cursor) > 0)
                    .sorted()
                    .limit(limit + 1L)
                    .toList();
            if (matching.size() <= limit) {
                return new KeyPage(matching, null);
            }
            List<String> page = List.copyOf(matching.subList(0, limit));
            return new KeyPage(page, page.get(page.size() - 1));
        });
    }

    public long size() {
        return cache.size();
    }

    public long getEvictedTotal() {
        return evictedTotal.get();
    }
}
