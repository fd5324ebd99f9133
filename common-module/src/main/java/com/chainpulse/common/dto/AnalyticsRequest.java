package com.chainpulse.common.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound body shared by every contract metric endpoint.
 * Timestamps are epoch seconds. Both are floored to the bucket grid before querying and the
 * resulting interval is closed, {@code [start, end]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsRequest {
	
	@NotEmpty(message = "contracts must contain at least one entry")
	private List<@Valid @NotNull ContractInput> contracts;
	
	@NotNull(message = "startTimestamp is required")
	@Positive(message = "startTimestamp must be positive")
	private Long startTimestamp;
	
	@NotNull(message = "endTimestamp is required")
	@Positive(message = "endTimestamp must be positive")
	private Long endTimestamp;
}
