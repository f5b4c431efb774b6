package com.lmbridge.pool;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Builds connection pools for the {@link PoolRouter}.
 */
@FunctionalInterface
public interface PoolFactory {

    /**
     * Create and validate a pool.
     *
     * @param settings connection settings
     * @return live pool
     * @throws SQLException if the pool cannot be created or the first connection fails
     */
    DataSource create(PoolSettings settings) throws SQLException;
}
