package com.factql.config;

import com.factql.store.HikariSqlExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection pool for the fact store. Built once at startup and shared by all requests;
 * startup fails when the store cannot be reached.
 */
@Slf4j
@Configuration
public class StoreConfig {
    static final String CLICKHOUSE_DRIVER = "com.clickhouse.jdbc.ClickHouseDriver";

    @Value("${factql.store.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${factql.store.username:default}")
    private String username;

    @Value("${factql.store.password:}")
    private String password;

    @Value("${factql.store.max-execution-time-sec:60}")
    private int maxExecutionTimeSec;

    @Value("${factql.store.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${factql.store.maximum-pool-size:10}")
    private int maximumPoolSize;

    @Value("${factql.store.minimum-idle:5}")
    private int minimumIdle;

    @Value("${factql.store.max-lifetime-ms:3600000}")
    private long maxLifetimeMs;

    @Bean(destroyMethod = "close")
    public HikariDataSource factStoreDataSource() {
        HikariDataSource ds = new HikariDataSource(buildHikariConfig());
        log.info("Connected to ClickHouse: {}", maskUrl(url));
        return ds;
    }

    HikariConfig buildHikariConfig() {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setDriverClassName(CLICKHOUSE_DRIVER);
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        // Server-side cap, independent of the per-request deadline.
        config.addDataSourceProperty("custom_settings", "max_execution_time=" + maxExecutionTimeSec);

        config.setConnectionTimeout(connectTimeoutMs);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setMaxLifetime(maxLifetimeMs);
        config.setPoolName("factql-store");
        return config;
    }

    static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("(?i)(password=)[^&]*", "$1****").replaceAll("//[^/@:]+:[^/@]+@", "//****@");
    }
}
