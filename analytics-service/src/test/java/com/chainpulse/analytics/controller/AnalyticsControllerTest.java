package com.chainpulse.analytics.controller;

import com.chainpulse.analytics.dto.AnalyticsResponse;
import com.chainpulse.analytics.dto.PartitionTotal;
import com.chainpulse.analytics.normalize.SupportedChain;
import com.chainpulse.analytics.service.FanOutAggregator;
import com.chainpulse.common.config.SecureObjectMapperConfig;
import com.chainpulse.common.dto.AnalyticsRequest;
import com.chainpulse.common.exception.ComputeException;
import com.chainpulse.common.exception.GlobalExceptionHandler;
import com.chainpulse.common.exception.NotFoundException;
import com.chainpulse.common.exception.QueryTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {
	
	private static final String BODY = "{\"contracts\":[{\"chain\":\"bsc\",\"address\":\"0xabc\"}],"
		+ "\"startTimestamp\":1000,\"endTimestamp\":5000}";
	
	private MockMvc mockMvc;
	
	@Mock
	private FanOutAggregator fanOutAggregator;
	
	@InjectMocks
	private AnalyticsController analyticsController;
	
	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.standaloneSetup(analyticsController)
			.setControllerAdvice(new GlobalExceptionHandler())
			.setMessageConverters(new MappingJackson2HttpMessageConverter(SecureObjectMapperConfig.create()))
			.build();
	}
	
	@Test
	void testGetMetric_ReturnsTotalsWithMetricField() throws Exception {
		AnalyticsResponse response = AnalyticsResponse.builder()
			.total(List.of(PartitionTotal.builder()
				.chain(SupportedChain.BSC)
				.metricField("txs")
				.value(new BigDecimal("12"))
				.build()))
			.startTimestamp(0L)
			.endTimestamp(3600L)
			.build();
		when(fanOutAggregator.execute(eq("contracts:total-txs"), any(AnalyticsRequest.class))).thenReturn(response);
		
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.total[0].chain").value("bsc"))
			.andExpect(jsonPath("$.total[0].txs").value(12))
			.andExpect(jsonPath("$.total[0].value").doesNotExist())
			.andExpect(jsonPath("$.startTimestamp").value(0))
			.andExpect(jsonPath("$.endTimestamp").value(3600));
	}
	
	@Test
	void testGetMetric_EmptyContracts_ReturnsBadRequest() throws Exception {
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"contracts\":[],\"startTimestamp\":1000,\"endTimestamp\":5000}"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
		
		verifyNoInteractions(fanOutAggregator);
	}
	
	@Test
	void testGetMetric_MissingTimestamp_ReturnsBadRequest() throws Exception {
		mockMvc.perform(post("/contracts/gas-usage")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"contracts\":[{\"chain\":\"bsc\",\"address\":\"0xabc\"}],\"endTimestamp\":5000}"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
			.andExpect(jsonPath("$.message").value("startTimestamp: startTimestamp is required"));
	}
	
	@Test
	void testGetMetric_MalformedJson_ReturnsBadRequest() throws Exception {
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"contracts\":"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"));
	}
	
	@Test
	void testGetMetric_InvertedInterval_ReturnsBadRequest() throws Exception {
		when(fanOutAggregator.execute(eq("contracts:total-txs"), any(AnalyticsRequest.class)))
			.thenThrow(new IllegalArgumentException("endTimestamp must not be before startTimestamp"));
		
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));
	}
	
	@Test
	void testGetMetric_UnknownMetric_ReturnsNotFound() throws Exception {
		when(fanOutAggregator.execute(eq("contracts:tvl"), any(AnalyticsRequest.class)))
			.thenThrow(new NotFoundException("Metric", "contracts:tvl"));
		
		mockMvc.perform(post("/contracts/tvl")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isNotFound())
			.andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
			.andExpect(jsonPath("$.path").value("/contracts/tvl"));
	}
	
	@Test
	void testGetMetric_ComputeFailed_ReturnsServiceUnavailable() throws Exception {
		when(fanOutAggregator.execute(eq("contracts:total-txs"), any(AnalyticsRequest.class)))
			.thenThrow(new ComputeException("contracts:total-txs", "Computation failed after 3 attempt(s)"));
		
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isServiceUnavailable())
			.andExpect(jsonPath("$.errorCode").value("COMPUTE_ERROR"));
	}
	
	@Test
	void testGetMetric_WaitTimedOut_ReturnsGatewayTimeout() throws Exception {
		when(fanOutAggregator.execute(eq("contracts:total-txs"), any(AnalyticsRequest.class)))
			.thenThrow(new QueryTimeoutException("Timed out after 60000 ms waiting for the result"));
		
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isGatewayTimeout())
			.andExpect(jsonPath("$.errorCode").value("TIMEOUT"));
	}
	
	@Test
	void testGetMetric_Unexpected_ReturnsInternalError() throws Exception {
		when(fanOutAggregator.execute(eq("contracts:total-txs"), any(AnalyticsRequest.class)))
			.thenThrow(new IllegalStateException("Unreadable result payload"));
		
		mockMvc.perform(post("/contracts/total-txs")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isInternalServerError())
			.andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"));
	}
	
	@Test
	void testEvictMetric_ReturnsNoContent() throws Exception {
		mockMvc.perform(delete("/contracts/gas-usage/cache")
				.contentType(MediaType.APPLICATION_JSON)
				.content(BODY))
			.andExpect(status().isNoContent());
		
		verify(fanOutAggregator).invalidate(eq("contracts:gas-usage"), any(AnalyticsRequest.class));
	}
}
