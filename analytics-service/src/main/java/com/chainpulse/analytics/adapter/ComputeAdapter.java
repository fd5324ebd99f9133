package com.chainpulse.analytics.adapter;

import com.chainpulse.analytics.dto.PartitionResult;
import com.chainpulse.common.exception.ComputeException;

/**
 * A metric computed against the warehouse for one chain at a time.
 * Implementations must be idempotent: a failed run may be repeated.
 */
public interface ComputeAdapter {

    /**
     * Adapter name, also the cache key namespace, e.g. {@code contracts:total-txs}.
     */
    String getName();

    /**
     * Name of the value field in the HTTP response, e.g. {@code txs}.
     */
    String getMetricField();

    PartitionResult compute(PartitionQuery query) throws ComputeException;
}
