package com.lmbridge.intercept;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Logs the duration and row count of every provider query at DEBUG.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class QueryLoggingInterceptor implements QueryInterceptor {

    @Override
    public String getName() {
        return "query-logging";
    }

    @Override
    public List<Map<String, Object>> intercept(QueryInvocation invocation, QueryChain chain) throws SQLException {
        if (!log.isDebugEnabled()) {
            return chain.proceed(invocation);
        }

        long startTime = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = chain.proceed(invocation);
            log.debug("Query {} on {} returned {} rows in {} ms",
                    invocation.getSqlFile(), invocation.getProvider().getName(),
                    rows != null ? rows.size() : 0, System.currentTimeMillis() - startTime);
            return rows;
        } catch (SQLException e) {
            log.debug("Query {} on {} failed after {} ms (SQLState: {})",
                    invocation.getSqlFile(), invocation.getProvider().getName(),
                    System.currentTimeMillis() - startTime, e.getSQLState());
            throw e;
        }
    }
}
