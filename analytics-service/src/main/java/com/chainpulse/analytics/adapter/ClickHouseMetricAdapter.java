package com.chainpulse.analytics.adapter;

import com.chainpulse.analytics.dto.PartitionResult;
import com.chainpulse.analytics.normalize.SupportedChain;
import com.chainpulse.common.exception.ComputeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-aggregate query over {@code <chain>.base_transactions} for transactions sent to a set
 * of contracts within an interval. Subclasses only supply the aggregate expression.
 *
 * <p>Addresses and timestamps are bound as parameters. The schema name comes from
 * {@link SupportedChain}, never from the request.
 */
@Slf4j
public abstract class ClickHouseMetricAdapter implements ComputeAdapter {

    private static final String QUERY_TEMPLATE =
            "SELECT %s AS total FROM %s.base_transactions bt"
                    + " WHERE bt.to_address IN (%s)"
                    + " AND bt.block_timestamp BETWEEN toDateTime(?, 'UTC') AND toDateTime(?, 'UTC')";

    private final JdbcTemplate jdbcTemplate;

    protected ClickHouseMetricAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * SQL aggregate over alias {@code bt}, e.g. {@code COUNT(*)}.
     */
    protected abstract String aggregateExpression();

    @Override
    public PartitionResult compute(PartitionQuery query) {
        if (query.addresses().isEmpty()) {
            return result(query, BigDecimal.ZERO);
        }

        String sql = buildSql(query.chain(), query.addresses().size());
        List<Object> args = new ArrayList<>(query.addresses());
        args.add(query.startTimestamp());
        args.add(query.endTimestamp());

        log.debug("Running {} on chain={} for {} address(es), interval=[{}, {}]",
                getName(), query.chain().getId(), query.addresses().size(),
                query.startTimestamp(), query.endTimestamp());

        try {
            BigDecimal total = jdbcTemplate.queryForObject(sql, BigDecimal.class, args.toArray());
            return result(query, total != null ? total : BigDecimal.ZERO);
        } catch (DataAccessException e) {
            throw new ComputeException(getName(),
                    String.format("%s query failed on chain %s: %s", getName(), query.chain().getId(),
                            e.getMostSpecificCause().getMessage()),
                    e);
        }
    }

    String buildSql(SupportedChain chain, int addressCount) {
        String placeholders = String.join(", ", Collections.nCopies(addressCount, "?"));
        return String.format(QUERY_TEMPLATE, aggregateExpression(), chain.getSchema(), placeholders);
    }

    private static PartitionResult result(PartitionQuery query, BigDecimal value) {
        return PartitionResult.builder()
                .chain(query.chain())
                .value(value)
                .startTimestamp(query.startTimestamp())
                .endTimestamp(query.endTimestamp())
                .build();
    }
}
