package com.chainpulse.analytics.coalescing;

/**
 * One computation of a cache key's payload. Must be idempotent: it may run up to the
 * configured attempt limit.
 */
@FunctionalInterface
public interface ComputeWork {

    /**
     * @return the serialized (JSON) result, never null
     */
    String compute() throws Exception;
}
