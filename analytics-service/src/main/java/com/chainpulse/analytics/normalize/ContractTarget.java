package com.chainpulse.analytics.normalize;

import java.util.Comparator;
import java.util.Objects;

/**
 * A contract on one chain. The address is always lowercase.
 */
public record ContractTarget(SupportedChain chain, String address) implements Comparable<ContractTarget> {

    private static final Comparator<ContractTarget> ORDER = Comparator
            .comparing((ContractTarget t) -> t.chain().getId())
            .thenComparing(ContractTarget::address);

    public ContractTarget {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(address, "address");
    }

    @Override
    public int compareTo(ContractTarget other) {
        return ORDER.compare(this, other);
    }
}
