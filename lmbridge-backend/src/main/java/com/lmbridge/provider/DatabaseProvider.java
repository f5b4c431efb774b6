package com.lmbridge.provider;

import com.lmbridge.pool.PoolSettings;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * A database-backed metadata provider whose queries run through the interception pipeline.
 */
public interface DatabaseProvider {

    /**
     * Provider name, used in query contexts and to scope secondary pools.
     *
     * @return provider name
     */
    String getName();

    /**
     * The provider's own pool, created lazily on first use.
     *
     * @return default pool
     * @throws SQLException if the pool cannot be created
     */
    DataSource getDefaultPool() throws SQLException;

    /**
     * Settings of the default pool; secondary pools inherit port, user and password from them.
     *
     * @return default pool settings
     */
    PoolSettings getDefaultPoolSettings();
}
