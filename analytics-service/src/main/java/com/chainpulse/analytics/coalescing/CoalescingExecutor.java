package com.chainpulse.analytics.coalescing;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Single-flight execution of keyed computations.
 * For any key at most one computation runs at a time; concurrent submitters for that key
 * attach to it and all observe the same outcome.
 */
public interface CoalescingExecutor {

    /**
     * Starts the computation for {@code key} on the worker pool, or attaches to the one already
     * running. On success the payload is persisted to the result store before waiters complete.
     * Failures are never cached.
     *
     * @param key the cache key ({@code <adapter>:<fingerprint>})
     * @param work the computation, run only if no unit for the key is in flight
     * @return a future private to this caller
     */
    CompletableFuture<String> submitAsync(String key, ComputeWork work);

    /**
     * Blocking variant of {@link #submitAsync}. On timeout the caller stops waiting but the
     * computation keeps running and still populates the cache.
     *
     * @throws com.chainpulse.common.exception.ComputeException if the computation failed on every attempt
     * @throws com.chainpulse.common.exception.QueryTimeoutException if {@code timeout} elapsed first
     */
    String submit(String key, ComputeWork work, Duration timeout);

    int inFlightCount();
}
