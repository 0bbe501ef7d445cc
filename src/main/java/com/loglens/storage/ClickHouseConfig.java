package com.loglens.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection pool used by search
 * execution and field discovery.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${loglens.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/loglens}")
    private String url;

    @Value("${loglens.storage.clickhouse.username:default}")
    private String username;

    @Value("${loglens.storage.clickhouse.password:}")
    private String password;

    @Value("${loglens.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${loglens.storage.clickhouse.max-execution-time:300}")
    private int maxExecutionSeconds;

    /**
     * Create ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        config.setPoolName("loglens-clickhouse");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        // ClickHouse-specific settings
        config.addDataSourceProperty("socket_timeout", "300000");
        config.addDataSourceProperty("compress", "true");
        config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionSeconds));

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("ClickHouse DataSource initialized: {}", url);
        return dataSource;
    }

    /**
     * Create JdbcTemplate for ClickHouse operations
     */
    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
