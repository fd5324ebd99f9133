package com.chainpulse.analytics.coalescing;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class InFlightUnitTest {

    @Test
    void newUnit_isRunningWithCreatorAsFirstWaiter() {
        InFlightUnit unit = new InFlightUnit("k", Instant.now());

        assertEquals(UnitStatus.RUNNING, unit.getStatus());
        assertEquals(1, unit.getWaiterCount());
        assertFalse(unit.isResolved());
    }

    @Test
    void attach_incrementsWaiters() {
        InFlightUnit unit = new InFlightUnit("k", Instant.now());

        assertEquals(2, unit.attach());
        assertEquals(3, unit.attach());
    }

    @Test
    void complete_resolvesEveryView() {
        InFlightUnit unit = new InFlightUnit("k", Instant.now());
        CompletableFuture<String> a = unit.waiterView();
        CompletableFuture<String> b = unit.waiterView();

        unit.complete("{}");

        assertEquals(UnitStatus.COMPLETED, unit.getStatus());
        assertEquals("{}", a.join());
        assertEquals("{}", b.join());
    }

    @Test
    void waiterView_cancellingDoesNotTouchUnit() {
        InFlightUnit unit = new InFlightUnit("k", Instant.now());

        unit.waiterView().cancel(true);

        assertFalse(unit.isResolved());
        unit.fail(new IllegalStateException("x"));
        assertEquals(UnitStatus.FAILED, unit.getStatus());
        assertTrue(unit.getOutcome().isCompletedExceptionally());
    }
}
