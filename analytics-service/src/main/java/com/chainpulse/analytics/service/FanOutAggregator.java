package com.chainpulse.analytics.service;

import com.chainpulse.analytics.adapter.ComputeAdapter;
import com.chainpulse.analytics.adapter.ComputeAdapterRegistry;
import com.chainpulse.analytics.coalescing.CompletionFailures;
import com.chainpulse.analytics.config.AnalyticsProperties;
import com.chainpulse.analytics.dto.AnalyticsResponse;
import com.chainpulse.analytics.dto.PartitionResult;
import com.chainpulse.analytics.dto.PartitionTotal;
import com.chainpulse.analytics.normalize.CanonicalRequest;
import com.chainpulse.analytics.normalize.RequestNormalizer;
import com.chainpulse.analytics.normalize.SupportedChain;
import com.chainpulse.common.dto.AnalyticsRequest;
import com.chainpulse.common.exception.QueryTimeoutException;
import com.chainpulse.common.validation.AnalyticsRequestValidator;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Entry point of a metric request. Splits the canonical request by chain, resolves every
 * partition through the {@link PartitionPipeline} concurrently and merges the results in chain
 * order. Partition lookups run on their own pool, one task per chain. A single failed partition
 * fails the whole request; partial totals are never returned.
 */
@Service
@Slf4j
public class FanOutAggregator {

    private final ComputeAdapterRegistry adapterRegistry;
    private final AnalyticsRequestValidator requestValidator;
    private final RequestNormalizer normalizer;
    private final PartitionPipeline pipeline;
    private final Duration waitTimeout;
    private final ThreadPoolExecutor lookupPool;

    public FanOutAggregator(ComputeAdapterRegistry adapterRegistry,
                            AnalyticsRequestValidator requestValidator,
                            RequestNormalizer normalizer,
                            PartitionPipeline pipeline,
                            AnalyticsProperties properties) {
        this.adapterRegistry = adapterRegistry;
        this.requestValidator = requestValidator;
        this.normalizer = normalizer;
        this.pipeline = pipeline;
        this.waitTimeout = properties.getCoalescing().getWaitTimeout();

        int lookupConcurrency = properties.getFanOut().getLookupConcurrency();
        this.lookupPool = new ThreadPoolExecutor(
                lookupConcurrency,
                lookupConcurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("partition-lookup-%d").setDaemon(true).build());
    }

    /**
     * @throws com.chainpulse.common.exception.NotFoundException unknown metric
     * @throws IllegalArgumentException invalid request
     * @throws com.chainpulse.common.exception.ComputeException a partition failed on every attempt
     * @throws QueryTimeoutException the wait timeout elapsed
     */
    public AnalyticsResponse execute(String adapterName, AnalyticsRequest raw) {
        ComputeAdapter adapter = adapterRegistry.get(adapterName);
        requestValidator.validateInput(raw);

        CanonicalRequest canonical = normalizer.normalize(adapterName, raw);
        if (canonical.isEmpty()) {
            log.debug("No supported contracts in request for adapter={}", adapterName);
            return response(List.of(), canonical);
        }

        List<CompletableFuture<PartitionResult>> partitions = new ArrayList<>();
        for (SupportedChain chain : canonical.chains()) {
            CanonicalRequest partition = normalizer.forChain(canonical, chain);
            partitions.add(CompletableFuture
                    .supplyAsync(() -> pipeline.run(adapter, partition, chain), lookupPool)
                    .thenCompose(Function.identity()));
        }

        awaitAll(adapterName, partitions);

        List<PartitionTotal> totals = partitions.stream()
                .map(CompletableFuture::join)
                .map(result -> PartitionTotal.builder()
                        .chain(result.getChain())
                        .metricField(adapter.getMetricField())
                        .value(result.getValue())
                        .build())
                .toList();

        log.debug("Resolved adapter={} over {} chain(s)", adapterName, totals.size());
        return response(totals, canonical);
    }

    /**
     * Drops every cached partition result of the request so the next call recomputes.
     */
    public void invalidate(String adapterName, AnalyticsRequest raw) {
        adapterRegistry.get(adapterName);
        requestValidator.validateInput(raw);

        CanonicalRequest canonical = normalizer.normalize(adapterName, raw);
        for (SupportedChain chain : canonical.chains()) {
            pipeline.evict(normalizer.forChain(canonical, chain));
        }
    }

    /**
     * Returns as soon as every partition succeeded or any one failed.
     */
    private void awaitAll(String adapterName, List<CompletableFuture<PartitionResult>> partitions) {
        CompletableFuture<?>[] all = partitions.toArray(new CompletableFuture<?>[0]);
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        partitions.forEach(partition -> partition.whenComplete((result, failure) -> {
            if (failure != null) {
                firstFailure.completeExceptionally(failure);
            }
        }));

        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(all), firstFailure)
                    .get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Gave up waiting after {} for adapter={}", waitTimeout, adapterName);
            throw new QueryTimeoutException("Timed out after " + waitTimeout.toMillis() + " ms waiting for the result");
        } catch (ExecutionException e) {
            throw CompletionFailures.unwrap(e, adapterName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("Interrupted while waiting for the result", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        lookupPool.shutdownNow();
    }

    private static AnalyticsResponse response(List<PartitionTotal> totals, CanonicalRequest canonical) {
        return AnalyticsResponse.builder()
                .total(totals)
                .startTimestamp(canonical.startTimestamp())
                .endTimestamp(canonical.endTimestamp())
                .build();
    }
}
