package com.lmbridge.intercept;

import com.lmbridge.provider.QueryExecutor;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Ordered chain of {@link QueryInterceptor}s ending in a {@link QueryExecutor}.
 *
 * The chain is fixed at construction; nothing is added or removed at runtime.
 */
@Slf4j
@Component
public class QueryPipeline {

    private final List<QueryInterceptor> interceptors;
    private final QueryExecutor executor;

    /**
     * Create a pipeline.
     *
     * @param interceptors interceptors, outermost first
     * @param executor terminal executor
     */
    public QueryPipeline(List<QueryInterceptor> interceptors, QueryExecutor executor) {
        this.interceptors = interceptors != null ? List.copyOf(interceptors) : List.of();
        this.executor = executor;
    }

    @PostConstruct
    public void logInterceptors() {
        log.info("Query pipeline: {} -> executor", interceptors.stream().map(QueryInterceptor::getName).toList());
    }

    /**
     * Run an invocation through every interceptor and the executor.
     *
     * @param invocation query to run
     * @return rows
     * @throws SQLException on database errors
     */
    public List<Map<String, Object>> execute(QueryInvocation invocation) throws SQLException {
        return proceed(0, invocation);
    }

    /**
     * Names of the registered interceptors, outermost first.
     *
     * @return interceptor names
     */
    public List<String> getInterceptorNames() {
        return interceptors.stream().map(QueryInterceptor::getName).toList();
    }

    private List<Map<String, Object>> proceed(int index, QueryInvocation invocation) throws SQLException {
        if (index >= interceptors.size()) {
            return executor.execute(invocation);
        }
        QueryInterceptor interceptor = interceptors.get(index);
        return interceptor.intercept(invocation, next -> proceed(index + 1, next));
    }
}
