package com.chainpulse.analytics.controller;

import com.chainpulse.analytics.constants.AnalyticsConstants;
import com.chainpulse.analytics.dto.AnalyticsResponse;
import com.chainpulse.analytics.service.FanOutAggregator;
import com.chainpulse.common.dto.AnalyticsRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/contracts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Contracts", description = "Per-chain activity metrics of smart contracts")
public class AnalyticsController {
	
	private final FanOutAggregator fanOutAggregator;
	
	@Operation(summary = "Compute a metric", description = "Metric is one of total-txs, gas-usage, total-unique-users. "
		+ "Timestamps are floored to the 30 minute grid and echoed back.")
	@PostMapping("/{metric}")
	public ResponseEntity<AnalyticsResponse> getMetric(
		@Parameter(description = "Metric name", example = "total-txs")
		@PathVariable String metric,
		@RequestBody
		@Valid
		AnalyticsRequest request) {

		log.debug("Metric request: metric={}, contracts={}", metric, request.getContracts().size());
		var response = fanOutAggregator.execute(AnalyticsConstants.buildAdapterName(metric), request);
		return ResponseEntity.ok(response);
	}
	
	@Operation(summary = "Evict cached results of a request")
	@DeleteMapping("/{metric}/cache")
	public ResponseEntity<Void> evictMetric(
		@PathVariable String metric,
		@RequestBody
		@Valid
		AnalyticsRequest request) {

		log.info("Cache eviction requested: metric={}", metric);
		fanOutAggregator.invalidate(AnalyticsConstants.buildAdapterName(metric), request);
		return ResponseEntity.noContent().build();
	}
}
