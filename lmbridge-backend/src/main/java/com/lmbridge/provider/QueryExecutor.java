package com.lmbridge.provider;

import com.lmbridge.intercept.QueryInvocation;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs one SQL statement and returns its rows. Terminal stage of the query pipeline.
 */
@FunctionalInterface
public interface QueryExecutor {

    /**
     * Execute the invocation.
     *
     * @param invocation SQL, arguments and optional connection to run on
     * @return rows in result-set order, column label to value
     * @throws SQLException on database errors
     */
    List<Map<String, Object>> execute(QueryInvocation invocation) throws SQLException;
}
