package com.chainpulse.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsResponse {

    private List<PartitionTotal> total;

    /**
     * Bucketed start of the interval actually queried, epoch seconds.
     */
    private long startTimestamp;

    private long endTimestamp;
}
