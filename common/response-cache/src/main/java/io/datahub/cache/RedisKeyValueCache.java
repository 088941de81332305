package io.datahub.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Redis-backed cache, shared by every process pointing at the same Redis.
 * Retention maps onto the native key expiry.
 */
public class RedisKeyValueCache implements KeyValueCache {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueCache.class);

    private final RedisTemplate<String, String> redis;

    public RedisKeyValueCache(RedisTemplate<String, String> redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        InMemoryKeyValueCache.requirePositive(ttl);
        try {
            redis.opsForValue().set(key, value, ttl);
        } catch (Exception e) {
            throw new CacheAccessException("Failed to store cache entry " + key, e);
        }
    }

    /**
     * Reads are best effort: an unreachable Redis is reported as a miss.
     */
    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (Exception e) {
            log.warn("Redis read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
