package com.chainpulse.analytics.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class MicrometerCacheMetrics implements CacheMetrics {

    private static final String CACHE_TAG = "cache";
    private static final String CACHE_NAME = "result";

    private final Counter hits;
    private final Counter misses;
    private final Counter errors;
    private final Counter unavailable;
    private final Counter invalidations;

    private final Timer getTimer;
    private final Timer putTimer;

    public MicrometerCacheMetrics(MeterRegistry meterRegistry) {
        this.hits = Counter.builder("cache.hits")
                .description("Result store lookups answered from cache")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.misses = Counter.builder("cache.misses")
                .description("Result store lookups with no entry")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.errors = Counter.builder("cache.errors")
                .description("Redis errors on result store operations")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.unavailable = Counter.builder("cache.unavailable")
                .description("Result store calls short-circuited by circuit breaker/bulkhead")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.invalidations = Counter.builder("cache.invalidations")
                .description("Explicit result store deletions")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.getTimer = Timer.builder("cache.get.duration")
                .description("Result store get duration")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);

        this.putTimer = Timer.builder("cache.put.duration")
                .description("Result store put duration")
                .tag(CACHE_TAG, CACHE_NAME)
                .register(meterRegistry);
    }

    @Override
    public <T> T recordGet(TimerCallable<T> action) {
        try {
            return getTimer.recordCallable(action::call);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public <T> T recordPut(Supplier<T> action) {
        return putTimer.record(action);
    }

    @Override
    public void hit() {
        hits.increment();
    }

    @Override
    public void miss() {
        misses.increment();
    }

    @Override
    public void error() {
        errors.increment();
    }

    @Override
    public void unavailable() {
        unavailable.increment();
    }

    @Override
    public void invalidated() {
        invalidations.increment();
    }
}
