package com.factql.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.factql.store.HikariSqlExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class StoreConfigTest {

    @Test
    void buildsPoolForClickHouse() {
        StoreConfig storeConfig = new StoreConfig();
        ReflectionTestUtils.setField(storeConfig, "url", "jdbc:clickhouse://ch:8123/analytics");
        ReflectionTestUtils.setField(storeConfig, "username", "reader");
        ReflectionTestUtils.setField(storeConfig, "password", "secret");
        ReflectionTestUtils.setField(storeConfig, "maxExecutionTimeSec", 60);
        ReflectionTestUtils.setField(storeConfig, "connectTimeoutMs", 5000L);
        ReflectionTestUtils.setField(storeConfig, "maximumPoolSize", 10);
        ReflectionTestUtils.setField(storeConfig, "minimumIdle", 5);
        ReflectionTestUtils.setField(storeConfig, "maxLifetimeMs", 3600000L);

        HikariConfig config = storeConfig.buildHikariConfig();

        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:clickhouse://ch:8123/analytics");
        assertThat(config.getDriverClassName()).isEqualTo("com.clickhouse.jdbc.ClickHouseDriver");
        assertThat(config.getUsername()).isEqualTo("reader");
        assertThat(config.getPassword()).isEqualTo("secret");
        assertThat(config.getDataSourceProperties().getProperty("custom_settings")).isEqualTo("max_execution_time=60");
        assertThat(config.getMaximumPoolSize()).isEqualTo(10);
        assertThat(config.getMinimumIdle()).isEqualTo(5);
        assertThat(config.getMaxLifetime()).isEqualTo(3600000L);
        assertThat(config.getConnectionTimeout()).isEqualTo(5000L);
        assertThat(config.getExceptionOverrideClassName()).isEqualTo(HikariSqlExceptionOverride.class.getName());
    }

    @Test
    void masksCredentialsInUrl() {
        assertThat(StoreConfig.maskUrl("jdbc:clickhouse://ch:8123/default?user=a&password=secret&ssl=true"))
                .isEqualTo("jdbc:clickhouse://ch:8123/default?user=a&password=****&ssl=true");
        assertThat(StoreConfig.maskUrl("jdbc:clickhouse://reader:secret@ch:8123/default"))
                .isEqualTo("jdbc:clickhouse://****@ch:8123/default");
        assertThat(StoreConfig.maskUrl("jdbc:clickhouse://ch:8123/default"))
                .isEqualTo("jdbc:clickhouse://ch:8123/default");
        assertThat(StoreConfig.maskUrl(null)).isNull();
    }
}
