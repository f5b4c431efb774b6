package com.lmbridge.pool;

import lombok.Builder;
import lombok.Data;

/**
 * Connection settings for one PostgreSQL pool.
 */
@Data
@Builder(toBuilder = true)
public class PoolSettings {
    private String poolName;
    private String host;
    private int port;
    private String user;
    private String password;
    private String database;

    @Builder.Default
    private int maximumPoolSize = 10;

    @Builder.Default
    private int minimumIdle = 1;

    @Builder.Default
    private long connectionTimeoutMs = 5000;

    /**
     * Build the JDBC URL for these settings.
     *
     * @return JDBC URL
     */
    public String toJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        // Never print the password.
        return "PoolSettings{poolName=" + poolName + ", host=" + host + ", port=" + port
                + ", user=" + user + ", database=" + database + "}";
    }
}
