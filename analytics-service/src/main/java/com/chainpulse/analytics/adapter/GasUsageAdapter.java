package com.chainpulse.analytics.adapter;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Gas spent calling the contracts, in native coin units (wei / 1e18).
 */
@Component
public class GasUsageAdapter extends ClickHouseMetricAdapter {

    public static final String NAME = "contracts:gas-usage";

    public GasUsageAdapter(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getMetricField() {
        return "gasUsage";
    }

    @Override
    protected String aggregateExpression() {
        return "SUM(bt.gas_used * bt.gas_price / 1e18)";
    }
}
