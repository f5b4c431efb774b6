package com.lmbridge.intercept;

import com.lmbridge.hooks.BeforeQueryResult;
import com.lmbridge.hooks.DbHookRegistry;
import com.lmbridge.hooks.QueryContext;
import com.lmbridge.pool.PoolRouter;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs the db hooks around a query and routes it to the pool they select.
 *
 * <p>Hook failures are contained by the {@link DbHookRegistry}; database errors from the chain
 * propagate unchanged. A connection borrowed from a routed pool is always returned.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 100)
public class DbHookInterceptor implements QueryInterceptor {

    private final DbHookRegistry hookRegistry;
    private final PoolRouter poolRouter;

    /**
     * Create the interceptor.
     *
     * @param hookRegistry hook registry
     * @param poolRouter pool router
     */
    public DbHookInterceptor(DbHookRegistry hookRegistry, PoolRouter poolRouter) {
        this.hookRegistry = hookRegistry;
        this.poolRouter = poolRouter;
    }

    @Override
    public String getName() {
        return "db-hooks";
    }

    @Override
    public List<Map<String, Object>> intercept(QueryInvocation invocation, QueryChain chain) throws SQLException {
        QueryContext context = QueryContext.builder()
                .providerName(invocation.getProvider().getName())
                .sql(invocation.getSql())
                .args(invocation.getArgs())
                .sqlFile(invocation.getSqlFile())
                .poolKey(PoolRouter.DEFAULT_POOL)
                .build();

        BeforeQueryResult before = hookRegistry.applyBefore(invocation.getSql(), invocation.getArgs(), context);
        context.setSql(before.getSql());
        context.setArgs(before.getArgs());
        context.setPoolKey(before.getPoolKey());

        QueryInvocation rewritten = invocation.withStatement(before.getSql(), before.getArgs());

        List<Map<String, Object>> results;
        if (!PoolRouter.DEFAULT_POOL.equals(before.getPoolKey())) {
            DataSource pool = poolRouter.getPool(invocation.getProvider(), before.getPoolKey());
            try (Connection conn = pool.getConnection()) {
                results = chain.proceed(rewritten.withConnection(conn));
            }
        } else {
            results = chain.proceed(rewritten);
        }

        return hookRegistry.applyAfter(results, context);
    }
}
