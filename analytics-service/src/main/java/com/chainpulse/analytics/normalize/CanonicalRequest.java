package com.chainpulse.analytics.normalize;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Normalized form of an analytics request: targets deduplicated and sorted, addresses
 * lowercase, both interval bounds floored to the bucket grid.
 * Two requests that differ only in ordering, casing or sub-bucket jitter are equal.
 */
public record CanonicalRequest(String adapter, List<ContractTarget> targets, long startTimestamp, long endTimestamp) {

    public CanonicalRequest {
        Objects.requireNonNull(adapter, "adapter");
        targets = List.copyOf(targets);
    }

    public List<SupportedChain> chains() {
        return targets.stream()
                .map(ContractTarget::chain)
                .distinct()
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .toList();
    }

    public List<String> addressesOn(SupportedChain chain) {
        return targets.stream()
                .filter(t -> t.chain() == chain)
                .map(ContractTarget::address)
                .toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return targets.isEmpty();
    }
}
