package com.chainpulse.analytics.coalescing;

import com.chainpulse.analytics.cache.CacheResult;
import com.chainpulse.analytics.cache.ResultStore;
import com.chainpulse.analytics.config.AnalyticsProperties;
import com.chainpulse.common.exception.ComputeException;
import com.chainpulse.common.exception.QueryTimeoutException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process coalescing queue.
 * A key maps to at most one {@link InFlightUnit}; the first submitter enqueues the work on a
 * bounded worker pool and later submitters attach to the same unit. Results are written to the
 * {@link ResultStore} before any waiter is released, so a request arriving after completion is
 * served from the cache instead of recomputing.
 */
@Service
@Slf4j
public class CoalescingQueueService implements CoalescingExecutor {

    private static final String WORKER_NAME_FORMAT = "coalesce-worker-%d";

    private final ResultStore resultStore;
    private final long resultTtlSeconds;
    private final int maxAttempts;
    private final Duration shutdownGrace;
    private final Retry retry;
    private final ThreadPoolExecutor workerPool;

    private final ConcurrentHashMap<String, InFlightUnit> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final Counter unitsCreated;
    private final Counter waitersAttached;
    private final Counter unitsFailed;
    private final Counter computeAttempts;
    private final Counter storeWriteFailures;
    private final Timer computeTimer;

    public CoalescingQueueService(ResultStore resultStore, AnalyticsProperties properties, MeterRegistry meterRegistry) {
        AnalyticsProperties.Coalescing settings = properties.getCoalescing();
        this.resultStore = resultStore;
        this.resultTtlSeconds = properties.getCache().getTtlSeconds();
        this.maxAttempts = settings.getMaxAttempts();
        this.shutdownGrace = settings.getShutdownGrace();

        this.retry = Retry.of("coalescing", RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .waitDuration(settings.getRetryWait())
                .build());

        this.workerPool = new ThreadPoolExecutor(
                settings.getWorkerConcurrency(),
                settings.getWorkerConcurrency(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(WORKER_NAME_FORMAT).build());

        this.unitsCreated = Counter.builder("coalescing.units.created").register(meterRegistry);
        this.waitersAttached = Counter.builder("coalescing.waiters.attached").register(meterRegistry);
        this.unitsFailed = Counter.builder("coalescing.units.failed").register(meterRegistry);
        this.computeAttempts = Counter.builder("coalescing.compute.attempts").register(meterRegistry);
        this.storeWriteFailures = Counter.builder("coalescing.store.write.failures").register(meterRegistry);
        this.computeTimer = Timer.builder("coalescing.compute.duration").register(meterRegistry);
        Gauge.builder("coalescing.in.flight", inFlight, ConcurrentHashMap::size).register(meterRegistry);
        Gauge.builder("coalescing.queue.depth", workerPool, pool -> pool.getQueue().size()).register(meterRegistry);

        log.info("Coalescing queue started: workers={}, maxAttempts={}, retryWait={}",
                settings.getWorkerConcurrency(), maxAttempts, settings.getRetryWait());
    }

    @Override
    public CompletableFuture<String> submitAsync(String key, ComputeWork work) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (shuttingDown.get()) {
            throw new IllegalStateException("Coalescing queue is shutting down");
        }

        AtomicBoolean created = new AtomicBoolean(false);
        InFlightUnit unit = inFlight.computeIfAbsent(key, k -> {
            created.set(true);
            return new InFlightUnit(k, Instant.now());
        });

        if (!created.get()) {
            int waiters = unit.attach();
            waitersAttached.increment();
            log.debug("[unit joined] key={} waiters={}", key, waiters);
            return unit.waiterView();
        }

        unitsCreated.increment();
        log.debug("[unit created] key={} queued={}", key, workerPool.getQueue().size());
        try {
            workerPool.execute(() -> run(unit, work));
        } catch (RejectedExecutionException e) {
            resolveFailure(unit, 0, e);
        }
        return unit.waiterView();
    }

    @Override
    public String submit(String key, ComputeWork work, Duration timeout) {
        CompletableFuture<String> waiter = submitAsync(key, work);
        try {
            return waiter.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the unit keeps running and will still populate the cache
            log.warn("Gave up waiting after {} for key={}", timeout, key);
            throw new QueryTimeoutException("Timed out after " + timeout.toMillis() + " ms waiting for the result");
        } catch (ExecutionException e) {
            throw CompletionFailures.unwrap(e, CompletionFailures.adapterOf(key));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("Interrupted while waiting for the result", e);
        }
    }

    @Override
    public int inFlightCount() {
        return inFlight.size();
    }

    private void run(InFlightUnit unit, ComputeWork work) {
        String key = unit.getKey();
        AtomicInteger attempts = new AtomicInteger();
        try {
            CacheResult<String> cached = resultStore.get(key);
            if (cached instanceof CacheResult.Hit<String> hit) {
                log.debug("[unit short-circuited] key={} already stored", key);
                resolveSuccess(unit, hit.value());
                return;
            }

            String payload = retry.executeCallable(attemptOf(key, work, attempts));

            if (!resultStore.put(key, payload, resultTtlSeconds)) {
                storeWriteFailures.increment();
                log.warn("Result for key={} delivered to waiters but not cached", key);
            }
            resolveSuccess(unit, payload);
        } catch (Exception e) {
            resolveFailure(unit, attempts.get(), e);
        } finally {
            if (!unit.isResolved()) {
                resolveFailure(unit, attempts.get(), new IllegalStateException("Computation aborted"));
            }
        }
    }

    private Callable<String> attemptOf(String key, ComputeWork work, AtomicInteger attempts) {
        return () -> {
            int attempt = attempts.incrementAndGet();
            computeAttempts.increment();
            if (attempt > 1) {
                log.warn("Retrying computation key={} attempt={}/{}", key, attempt, maxAttempts);
            }
            String payload = computeTimer.recordCallable(work::compute);
            if (payload == null) {
                throw new ComputeException(CompletionFailures.adapterOf(key), "Computation returned no result");
            }
            return payload;
        };
    }

    private void resolveSuccess(InFlightUnit unit, String payload) {
        inFlight.remove(unit.getKey(), unit);
        unit.complete(payload);
        log.debug("[unit completed] key={} waiters={} tookMs={}", unit.getKey(), unit.getWaiterCount(),
                Duration.between(unit.getCreatedAt(), Instant.now()).toMillis());
    }

    private void resolveFailure(InFlightUnit unit, int attempts, Throwable cause) {
        if (unit.isResolved()) {
            return;
        }
        String key = unit.getKey();
        inFlight.remove(key, unit);
        unitsFailed.increment();
        log.error("Computation failed for key={} after {} attempt(s), waiters={}: {}",
                key, attempts, unit.getWaiterCount(), cause.toString());
        unit.fail(new ComputeException(
                CompletionFailures.adapterOf(key),
                "Computation failed after " + attempts + " attempt(s)",
                cause));
    }

    /**
     * Stops intake, lets queued and running units finish within the grace period, then fails
     * whatever is left so no waiter hangs.
     */
    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Draining coalescing queue: inFlight={}, queued={}", inFlight.size(), workerPool.getQueue().size());
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = workerPool.shutdownNow();
                log.warn("Shutdown grace of {} exceeded, dropped {} queued computation(s)", shutdownGrace, dropped.size());
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        inFlight.values().forEach(unit ->
                resolveFailure(unit, 0, new IllegalStateException("Service shutting down")));
    }
}
