package com.chainpulse.analytics.dto;

import com.chainpulse.analytics.normalize.SupportedChain;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One entry of {@code total}. Serialized as {@code {"chain": "...", "<metricField>": value}},
 * the value key depending on the metric ({@code txs}, {@code gasUsage}, {@code users}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"chain"})
public class PartitionTotal {

    private SupportedChain chain;

    @JsonIgnore
    private String metricField;

    @JsonIgnore
    private BigDecimal value;

    @JsonAnyGetter
    public Map<String, BigDecimal> metric() {
        return Map.of(metricField, value);
    }
}
