package fr.lapetina.streamflow.infrastructure.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key/value backend for {@link ResponseCache}.
 *
 * Implementations must be thread-safe, must never return an expired entry and must never
 * expose a partially written one. Any operation may fail with {@link CacheStoreException}.
 */
public interface CacheStore {

    /**
     * Returns a copy of the live entry for {@code key}, or empty when absent or expired.
     */
    Optional<byte[]> get(String key);

    /**
     * Stores a copy of {@code value}, replacing any previous entry for {@code key}.
     */
    void set(String key, byte[] value, Duration ttl);

    void delete(String key);

    void clear();

    boolean exists(String key);

    /**
     * Returns the keys of all live entries, in no particular order.
     */
    List<String> list();
}
