package com.lmbridge.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link PoolFactory} backed by HikariCP and the PostgreSQL JDBC driver.
 */
@Slf4j
@Component
public class HikariPoolFactory implements PoolFactory {

    @Override
    public DataSource create(PoolSettings settings) throws SQLException {
        HikariConfig config = buildHikariConfig(settings);
        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new SQLException("Failed to start pool " + settings.getPoolName() + ": " + e.getMessage(), e);
        }

        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(5)) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            ds.close();
            throw e;
        }

        log.info("Created connection pool {} ({})", settings.getPoolName(), settings);
        return ds;
    }

    HikariConfig buildHikariConfig(PoolSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setDriverClassName("org.postgresql.Driver");
        config.setJdbcUrl(settings.toJdbcUrl());
        config.setUsername(settings.getUser());
        config.setPassword(settings.getPassword());

        // Shows up as pg_stat_activity.application_name.
        config.addDataSourceProperty("ApplicationName", "lmbridge");
        // Server-side prepared statements off.
        config.addDataSourceProperty("prepareThreshold", "0");

        config.setConnectionTimeout(settings.getConnectionTimeoutMs());
        config.setMaximumPoolSize(settings.getMaximumPoolSize());
        config.setMinimumIdle(settings.getMinimumIdle());
        config.setPoolName(settings.getPoolName());
        config.setReadOnly(true);
        return config;
    }
}
