package io.datahub.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value storage with a retention window per entry.
 * <p>
 * Retention is a safety net for eviction, not a freshness signal: an entry is served as long as it
 * has not expired, however old the data inside it is.
 */
public interface KeyValueCache {

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry.
     *
     * @throws CacheAccessException when the backing store rejects the write
     */
    void put(String key, String value, Duration ttl);

    /**
     * Returns the value stored under {@code key}, or empty on a miss or an expired entry.
     */
    Optional<String> get(String key);
}
