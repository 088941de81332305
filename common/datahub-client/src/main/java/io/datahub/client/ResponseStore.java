package io.datahub.client;

import io.datahub.cache.KeyValueCache;
import io.datahub.client.auth.TokenStore;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Last known-good response bodies, keyed by caller-supplied cache keys.
 */
public class ResponseStore {

    private final KeyValueCache cache;
    private final Duration retention;

    public ResponseStore(KeyValueCache cache, Duration retention) {
        this.cache = Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(retention, "retention");
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
    }

    public void save(String cacheKey, String rawBody) {
        cache.put(requireResponseKey(cacheKey), Objects.requireNonNull(rawBody, "rawBody"), retention);
    }

    public Optional<String> lastGood(String cacheKey) {
        return cache.get(requireResponseKey(cacheKey));
    }

    /**
     * Rejects blank keys and keys that would collide with the token namespace.
     */
    public static String requireResponseKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cacheKey must not be null or blank");
        }
        if (TokenStore.isTokenKey(key)) {
            throw new IllegalArgumentException("cacheKey must not use the token namespace: " + key);
        }
        return key;
    }
}
