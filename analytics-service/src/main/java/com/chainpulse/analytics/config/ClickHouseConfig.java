package com.chainpulse.analytics.config;

import com.chainpulse.common.util.SensitiveDataFilter;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Warehouse connection pool. Sized to the coalescing worker pool: every running
 * computation holds at most one connection.
 */
@Configuration
@Slf4j
public class ClickHouseConfig {

    @Value("${analytics.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${analytics.clickhouse.username:default}")
    private String username;

    @Value("${analytics.clickhouse.password:}")
    private String password;

    @Value("${analytics.clickhouse.query-timeout-seconds:120}")
    private int queryTimeoutSeconds;

    @Bean(name = "clickHouseDataSource", destroyMethod = "close")
    public HikariDataSource clickHouseDataSource(AnalyticsProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("clickhouse");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");

        config.setMaximumPoolSize(properties.getCoalescing().getWorkerConcurrency());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30_000);
        config.setIdleTimeout(600_000);
        config.setMaxLifetime(1_800_000);
        // lazily connect so the service can boot while the warehouse is still coming up
        config.setInitializationFailTimeout(-1);

        config.addDataSourceProperty("compress", "true");
        config.addDataSourceProperty("socket_timeout", String.valueOf(queryTimeoutSeconds * 1000L));

        log.info("ClickHouse DataSource configured: url={}, poolSize={}",
                SensitiveDataFilter.maskSensitiveData(url), config.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(DataSource clickHouseDataSource) {
        JdbcTemplate template = new JdbcTemplate(clickHouseDataSource);
        template.setQueryTimeout(queryTimeoutSeconds);
        return template;
    }
}
