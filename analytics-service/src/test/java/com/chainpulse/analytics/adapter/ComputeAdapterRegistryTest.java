package com.chainpulse.analytics.adapter;

import com.chainpulse.common.exception.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ComputeAdapterRegistryTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);

    @Test
    void get_whenRegistered_thenReturnsAdapter() {
        ComputeAdapterRegistry registry = new ComputeAdapterRegistry(List.of(
                new TotalTxsAdapter(jdbcTemplate),
                new GasUsageAdapter(jdbcTemplate),
                new TotalUniqueUsersAdapter(jdbcTemplate)));

        assertInstanceOf(GasUsageAdapter.class, registry.get("contracts:gas-usage"));
        assertInstanceOf(TotalTxsAdapter.class, registry.get("contracts:total-txs"));
        assertInstanceOf(TotalUniqueUsersAdapter.class, registry.get("contracts:total-unique-users"));
    }

    @Test
    void get_whenUnknown_thenNotFound() {
        ComputeAdapterRegistry registry = new ComputeAdapterRegistry(List.of(new TotalTxsAdapter(jdbcTemplate)));

        NotFoundException ex = assertThrows(NotFoundException.class, () -> registry.get("contracts:tvl"));
        assertEquals("Metric 'contracts:tvl' not found", ex.getMessage());
        assertThrows(NotFoundException.class, () -> registry.get(null));
    }

    @Test
    void constructor_whenDuplicateNames_thenFails() {
        assertThrows(IllegalStateException.class, () -> new ComputeAdapterRegistry(List.of(
                new TotalTxsAdapter(jdbcTemplate),
                new TotalTxsAdapter(jdbcTemplate))));
    }
}
