package com.lmbridge.pool;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps pooled connections alive on statement-level errors.
 *
 * Db hooks may rewrite SQL; a rewrite that produces invalid SQL or references a missing relation
 * fails the statement but leaves the connection healthy, so it must not be evicted.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        // 0A: feature not supported, 22: data exception, 42: syntax error or access rule violation
        if (sqlState.startsWith("0A") || sqlState.startsWith("22") || sqlState.startsWith("42")) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
