package com.chainpulse.analytics.service;

import com.chainpulse.analytics.adapter.ComputeAdapter;
import com.chainpulse.analytics.adapter.PartitionQuery;
import com.chainpulse.analytics.cache.CacheResult;
import com.chainpulse.analytics.cache.ResultStore;
import com.chainpulse.analytics.coalescing.CoalescingExecutor;
import com.chainpulse.analytics.dto.PartitionResult;
import com.chainpulse.analytics.fingerprint.RequestFingerprinter;
import com.chainpulse.analytics.normalize.CanonicalRequest;
import com.chainpulse.analytics.normalize.SupportedChain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Cache-aside lookup for a single chain partition, falling through to the coalescing queue.
 * One generic pipeline serves every {@link ComputeAdapter}.
 */
@Service
@Slf4j
public class PartitionPipeline {

    private final RequestFingerprinter fingerprinter;
    private final ResultStore resultStore;
    private final CoalescingExecutor coalescingExecutor;
    private final ObjectMapper objectMapper;

    public PartitionPipeline(RequestFingerprinter fingerprinter,
                             ResultStore resultStore,
                             CoalescingExecutor coalescingExecutor,
                             ObjectMapper objectMapper) {
        this.fingerprinter = fingerprinter;
        this.resultStore = resultStore;
        this.coalescingExecutor = coalescingExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * @param partition canonical request restricted to {@code chain}
     * @return completes with the cached or freshly computed result, or exceptionally with a
     *         {@link com.chainpulse.common.exception.ComputeException}
     */
    public CompletableFuture<PartitionResult> run(ComputeAdapter adapter, CanonicalRequest partition, SupportedChain chain) {
        String cacheKey = fingerprinter.cacheKey(partition);

        CacheResult<String> cached = resultStore.get(cacheKey);
        if (cached instanceof CacheResult.Hit<String> hit) {
            PartitionResult decoded = tryDecode(cacheKey, hit.value(), chain);
            if (decoded != null) {
                return CompletableFuture.completedFuture(decoded);
            }
            // unreadable or stale entry, drop it and recompute
            resultStore.delete(cacheKey);
        } else if (cached instanceof CacheResult.Error<String> error) {
            log.warn("Result store unavailable for key={}, continuing without cache: {}", cacheKey, error.cause().toString());
        }

        PartitionQuery query = new PartitionQuery(
                chain,
                partition.addressesOn(chain),
                partition.startTimestamp(),
                partition.endTimestamp());

        return coalescingExecutor
                .submitAsync(cacheKey, () -> encode(adapter.compute(query)))
                .thenApply(payload -> decode(cacheKey, payload));
    }

    public void evict(CanonicalRequest partition) {
        String cacheKey = fingerprinter.cacheKey(partition);
        resultStore.delete(cacheKey);
        log.info("Evicted cached result key={}", cacheKey);
    }

    private String encode(PartitionResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }

    private PartitionResult decode(String cacheKey, String payload) {
        try {
            return objectMapper.readValue(payload, PartitionResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable result payload for key=" + cacheKey, e);
        }
    }

    /**
     * @return the cached result, or null when the payload does not parse or does not describe
     *         {@code chain} with a value
     */
    private PartitionResult tryDecode(String cacheKey, String payload, SupportedChain chain) {
        PartitionResult decoded;
        try {
            decoded = objectMapper.readValue(payload, PartitionResult.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached result key={}: {}", cacheKey, e.getOriginalMessage());
            return null;
        }
        if (decoded == null || decoded.getValue() == null || decoded.getChain() != chain) {
            log.warn("Discarding incomplete cached result key={} for chain={}", cacheKey, chain);
            return null;
        }
        return decoded;
    }
}
