package com.chainpulse.analytics.coalescing;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single running computation for a key plus everyone waiting on it.
 * The submitter that created the unit counts as its first waiter.
 */
@Getter
public final class InFlightUnit {

    private final String key;
    private final Instant createdAt;
    private final CompletableFuture<String> outcome = new CompletableFuture<>();
    private final AtomicInteger waiters = new AtomicInteger(1);
    private volatile UnitStatus status = UnitStatus.RUNNING;

    InFlightUnit(String key, Instant createdAt) {
        this.key = key;
        this.createdAt = createdAt;
    }

    int attach() {
        return waiters.incrementAndGet();
    }

    /**
     * A per-waiter view of the outcome. Cancelling or completing it leaves the unit and the
     * other waiters untouched.
     */
    CompletableFuture<String> waiterView() {
        return outcome.copy();
    }

    boolean isResolved() {
        return outcome.isDone();
    }

    void complete(String payload) {
        status = UnitStatus.COMPLETED;
        outcome.complete(payload);
    }

    void fail(Throwable cause) {
        status = UnitStatus.FAILED;
        outcome.completeExceptionally(cause);
    }

    public int getWaiterCount() {
        return waiters.get();
    }
}
