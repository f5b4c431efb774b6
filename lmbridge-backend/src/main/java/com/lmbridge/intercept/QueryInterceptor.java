package com.lmbridge.intercept;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Middleware around provider queries.
 *
 * <p>Interceptors are Spring beans ordered with {@link org.springframework.core.annotation.Order};
 * the lowest order runs outermost. Each one may change the invocation before calling
 * {@link QueryChain#proceed} and may change the rows it returns.
 */
public interface QueryInterceptor {

    /**
     * Short name for logs.
     *
     * @return interceptor name
     */
    String getName();

    /**
     * Handle one query.
     *
     * @param invocation query to run
     * @param chain rest of the pipeline
     * @return rows
     * @throws SQLException on database errors from the chain
     */
    List<Map<String, Object>> intercept(QueryInvocation invocation, QueryChain chain) throws SQLException;
}
