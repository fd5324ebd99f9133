package com.chainpulse.analytics.cache;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Redis-backed store of computed partition results, keyed by cache key
 * ({@code <adapter>:<fingerprint>}) under the {@code result:} namespace.
 *
 * <p>Payloads are JSON strings written and read back byte for byte. Entries are immutable
 * once written: the same key always carries the same bytes, so racing writers are harmless.
 * No operation throws on backend failure; reads report {@link CacheResult.Error} and writes
 * report {@code false}.
 */
@Service
@Slf4j
public class ResultStore {

    public static final String KEY_PREFIX = "result:";

    private final RedisTemplate<String, String> redisTemplate;
    private final CacheMetrics metrics;

    public ResultStore(RedisTemplate<String, String> redisTemplate, CacheMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    public static String storageKey(String cacheKey) {
        return KEY_PREFIX + cacheKey;
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    @Bulkhead(name = "redis", fallbackMethod = "getFallback")
    public CacheResult<String> get(String cacheKey) {
        if (isBlank(cacheKey)) {
            log.warn("Attempted to read result with null/blank key");
            return CacheResult.miss();
        }

        try {
            return metrics.recordGet(() -> getFromRedis(cacheKey));
        } catch (Exception e) {
            metrics.error();
            log.warn("Result store get failed for key={}", cacheKey, e);
            return CacheResult.error(e);
        }
    }

    private CacheResult<String> getFromRedis(String cacheKey) {
        try {
            String value = redisTemplate.opsForValue().get(storageKey(cacheKey));

            if (value == null) {
                metrics.miss();
                log.debug("[cache miss] {}", cacheKey);
                return CacheResult.miss();
            }

            metrics.hit();
            log.debug("[cache hit] {}", cacheKey);
            return CacheResult.hit(value);

        } catch (Exception e) {
            metrics.error();
            log.warn("Redis get error for key={}", cacheKey, e);
            return CacheResult.error(e);
        }
    }

    @SuppressWarnings("unused")
    public CacheResult<String> getFallback(String cacheKey, Throwable t) {
        metrics.unavailable();
        log.warn("Result store get fallback triggered for key={}", cacheKey, t);
        return CacheResult.error(t);
    }

    /**
     * Writes (or overwrites) the payload with a fixed TTL.
     *
     * @return true if Redis acknowledged the write
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    @Bulkhead(name = "redis", fallbackMethod = "putFallback")
    public boolean put(String cacheKey, String payload, long ttlSeconds) {
        if (isBlank(cacheKey)) {
            log.warn("Attempted to store result with null/blank key");
            return false;
        }
        if (payload == null) {
            log.warn("Attempted to store null result for key={}", cacheKey);
            return false;
        }
        if (ttlSeconds <= 0) {
            log.warn("Invalid TTL={} seconds for key={}. Skipping result store put.", ttlSeconds, cacheKey);
            return false;
        }

        try {
            return metrics.recordPut(() -> putToRedis(cacheKey, payload, ttlSeconds));
        } catch (Exception e) {
            metrics.error();
            log.warn("Result store put failed for key={}", cacheKey, e);
            return false;
        }
    }

    private boolean putToRedis(String cacheKey, String payload, long ttlSeconds) {
        try {
            redisTemplate.opsForValue().set(storageKey(cacheKey), payload, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Stored result key={} ttl={}s", cacheKey, ttlSeconds);
            return true;
        } catch (Exception e) {
            metrics.error();
            log.warn("Redis put error for key={}", cacheKey, e);
            return false;
        }
    }

    @SuppressWarnings("unused")
    public boolean putFallback(String cacheKey, String payload, long ttlSeconds, Throwable t) {
        metrics.unavailable();
        log.warn("Result store put fallback triggered for key={}", cacheKey, t);
        return false;
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "deleteFallback")
    public void delete(String cacheKey) {
        if (isBlank(cacheKey)) {
            log.warn("Attempted to delete result with null/blank key");
            return;
        }

        try {
            Boolean removed = redisTemplate.delete(storageKey(cacheKey));
            metrics.invalidated();
            log.info("Invalidated result key={} existed={}", cacheKey, Boolean.TRUE.equals(removed));
        } catch (Exception e) {
            metrics.error();
            log.warn("Redis delete error for key={}", cacheKey, e);
        }
    }

    @SuppressWarnings("unused")
    public void deleteFallback(String cacheKey, Throwable t) {
        metrics.unavailable();
        log.warn("Result store delete fallback triggered for key={}", cacheKey, t);
    }

    private boolean isBlank(String key) {
        return key == null || key.isBlank();
    }
}
