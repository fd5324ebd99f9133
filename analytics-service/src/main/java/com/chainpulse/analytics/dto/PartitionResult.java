package com.chainpulse.analytics.dto;

import com.chainpulse.analytics.normalize.SupportedChain;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Metric value of one chain over one interval. This is the payload stored in the result cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionResult {

    private SupportedChain chain;
    private BigDecimal value;
    private long startTimestamp;
    private long endTimestamp;
}
