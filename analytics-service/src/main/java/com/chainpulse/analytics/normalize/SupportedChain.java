package com.chainpulse.analytics.normalize;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Independently queryable data partitions. Each chain lives in its own warehouse database.
 */
public enum SupportedChain {

    BSC("bsc"),
    ETHEREUM("ethereum");

    private final String id;

    SupportedChain(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Warehouse database holding this chain's tables. Only ever taken from this enum,
     * never from request input.
     */
    public String getSchema() {
        return id;
    }

    public static Optional<SupportedChain> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SupportedChain chain : values()) {
            if (chain.id.equals(normalized)) {
                return Optional.of(chain);
            }
        }
        return Optional.empty();
    }
}
