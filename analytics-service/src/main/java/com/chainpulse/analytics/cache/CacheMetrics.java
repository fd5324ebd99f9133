package com.chainpulse.analytics.cache;

import java.util.function.Supplier;

public interface CacheMetrics {

    <T> T recordGet(TimerCallable<T> action);

    <T> T recordPut(Supplier<T> action);

    void hit();
    void miss();
    void error();
    void unavailable();
    void invalidated();

    @FunctionalInterface
    interface TimerCallable<T> {
        T call() throws Exception;
    }
}
