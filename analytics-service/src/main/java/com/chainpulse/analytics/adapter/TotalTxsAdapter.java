package com.chainpulse.analytics.adapter;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Number of transactions sent to the contracts.
 */
@Component
public class TotalTxsAdapter extends ClickHouseMetricAdapter {

    public static final String NAME = "contracts:total-txs";

    public TotalTxsAdapter(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getMetricField() {
        return "txs";
    }

    @Override
    protected String aggregateExpression() {
        return "COUNT(*)";
    }
}
