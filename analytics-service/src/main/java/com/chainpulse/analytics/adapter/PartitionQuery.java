package com.chainpulse.analytics.adapter;

import com.chainpulse.analytics.normalize.SupportedChain;

import java.util.List;

/**
 * Input of a single adapter run: one chain, lowercase addresses, bucketed interval in epoch seconds.
 */
public record PartitionQuery(SupportedChain chain, List<String> addresses, long startTimestamp, long endTimestamp) {

    public PartitionQuery {
        addresses = List.copyOf(addresses);
    }
}
