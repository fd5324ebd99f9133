package com.chainpulse.analytics.normalize;

import com.chainpulse.analytics.config.AnalyticsProperties;
import com.chainpulse.common.dto.AnalyticsRequest;
import com.chainpulse.common.dto.ContractInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a validated request into its {@link CanonicalRequest}.
 * Unsupported chains are dropped, never rejected: they simply request no data.
 */
@Component
@Slf4j
public class RequestNormalizer {

    private final long bucketSeconds;
    private final Set<SupportedChain> enabledChains;

    public RequestNormalizer(AnalyticsProperties properties) {
        this.bucketSeconds = properties.getNormalization().getBucketSeconds();
        this.enabledChains = Set.copyOf(properties.getSupportedChains());
    }

    public CanonicalRequest normalize(String adapter, AnalyticsRequest raw) {
        TreeSet<ContractTarget> targets = new TreeSet<>();
        int dropped = 0;

        for (ContractInput contract : raw.getContracts()) {
            Optional<SupportedChain> chain = SupportedChain.fromId(contract.getChain())
                    .filter(enabledChains::contains);
            if (chain.isEmpty()) {
                dropped++;
                continue;
            }
            targets.add(new ContractTarget(chain.get(), normalizeAddress(contract.getAddress())));
        }

        if (dropped > 0) {
            log.debug("Dropped {} contract(s) on unsupported chains for adapter={}", dropped, adapter);
        }

        return new CanonicalRequest(
                adapter,
                List.copyOf(targets),
                bucket(raw.getStartTimestamp()),
                bucket(raw.getEndTimestamp())
        );
    }

    /**
     * Normalizing an already canonical request is a no-op.
     */
    public CanonicalRequest renormalize(CanonicalRequest canonical) {
        return new CanonicalRequest(
                canonical.adapter(),
                sortedDistinct(canonical.targets().stream()
                        .filter(t -> enabledChains.contains(t.chain()))
                        .map(t -> new ContractTarget(t.chain(), normalizeAddress(t.address())))
                        .toList()),
                bucket(canonical.startTimestamp()),
                bucket(canonical.endTimestamp())
        );
    }

    /**
     * The single-chain slice of a canonical request, the unit that is fingerprinted and cached.
     */
    public CanonicalRequest forChain(CanonicalRequest canonical, SupportedChain chain) {
        return new CanonicalRequest(
                canonical.adapter(),
                canonical.targets().stream().filter(t -> t.chain() == chain).toList(),
                canonical.startTimestamp(),
                canonical.endTimestamp()
        );
    }

    public long bucket(long epochSeconds) {
        return Math.floorDiv(epochSeconds, bucketSeconds) * bucketSeconds;
    }

    private static String normalizeAddress(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }

    private static List<ContractTarget> sortedDistinct(Collection<ContractTarget> targets) {
        return List.copyOf(new TreeSet<>(targets));
    }
}
