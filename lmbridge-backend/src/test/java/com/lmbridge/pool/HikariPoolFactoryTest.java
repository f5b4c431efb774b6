package com.lmbridge.pool;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HikariPoolFactory")
class HikariPoolFactoryTest {

    @Test
    @DisplayName("builds a read-only PostgreSQL pool configuration")
    void buildsConfig() {
        PoolSettings settings = PoolSettings.builder()
                .poolName("lmbridge-replica")
                .host("replica")
                .port(6432)
                .user("reader")
                .password("pw")
                .database("mb")
                .build();

        HikariConfig config = new HikariPoolFactory().buildHikariConfig(settings);

        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://replica:6432/mb");
        assertThat(config.getUsername()).isEqualTo("reader");
        assertThat(config.getPoolName()).isEqualTo("lmbridge-replica");
        assertThat(config.isReadOnly()).isTrue();
        assertThat(config.getMaximumPoolSize()).isEqualTo(10);
        assertThat(config.getDataSourceProperties()).containsEntry("prepareThreshold", "0");
        assertThat(settings.toString()).doesNotContain("pw");
    }

    @Test
    @DisplayName("keeps connections for statement-level errors")
    void exceptionOverride() {
        HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

        assertThat(override.adjudicate(new SQLException("syntax", "42601")))
                .isEqualTo(HikariSqlExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLFeatureNotSupportedException("nope")))
                .isEqualTo(HikariSqlExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("io", "08006")))
                .isEqualTo(HikariSqlExceptionOverride.Override.CONTINUE_EVICT);
    }
}
