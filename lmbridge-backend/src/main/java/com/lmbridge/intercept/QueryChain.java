package com.lmbridge.intercept;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * The remainder of the pipeline, as seen by a {@link QueryInterceptor}.
 */
@FunctionalInterface
public interface QueryChain {

    List<Map<String, Object>> proceed(QueryInvocation invocation) throws SQLException;
}
