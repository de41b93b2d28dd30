package ai.pipestream.transfer.metadata;

import io.smallrye.mutiny.Uni;

/**
 * Key-value store holding sessions, chunk records and archive records.
 * <p>
 * Values are opaque strings. {@link #putIfAbsent}, {@link #replace} and {@link #increment} are
 * atomic per key; nothing is atomic across keys. Missing values are reported as a null item.
 */
public interface MetadataStore {

    Uni<String> get(String key);

    Uni<Void> put(String key, String value);

    /**
     * Stores the value only if the key is absent.
     *
     * @return null when this call created the key, otherwise the value already present
     */
    Uni<String> putIfAbsent(String key, String value);

    /**
     * Compare-and-set: replaces the value only if the current value equals {@code expected}.
     *
     * @return true if the value was replaced
     */
    Uni<Boolean> replace(String key, String expected, String value);

    /**
     * Atomically adds {@code delta} to a numeric value, creating it at zero when absent.
     *
     * @return the new value
     */
    Uni<Long> increment(String key, long delta);

    Uni<Void> delete(String key);

    /**
     * Lists keys starting with {@code prefix} in ascending order.
     *
     * @param cursor the last key of the previous page, or null to start from the beginning
     * @param limit  maximum number of keys in the page
     */
    Uni<KeyPage> list(String prefix, String cursor, int limit);
}
