package com.chainpulse.analytics.adapter;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Distinct senders that called the contracts.
 */
@Component
public class TotalUniqueUsersAdapter extends ClickHouseMetricAdapter {

    public static final String NAME = "contracts:total-unique-users";

    public TotalUniqueUsersAdapter(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getMetricField() {
        return "users";
    }

    @Override
    protected String aggregateExpression() {
        return "COUNT(DISTINCT bt.from_address)";
    }
}
