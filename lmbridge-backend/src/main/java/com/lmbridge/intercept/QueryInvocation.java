package com.lmbridge.intercept;

import com.lmbridge.provider.DatabaseProvider;
import lombok.Builder;
import lombok.Getter;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of one query travelling through the {@link QueryPipeline}.
 *
 * <p>{@code connection} is set when the statement must run on a specific connection: one held
 * by the caller, or one borrowed from a routed pool. When it is null the executor borrows from
 * the provider's default pool.
 */
@Getter
@Builder(toBuilder = true)
public class QueryInvocation {
    private final DatabaseProvider provider;
    private final String sql;
    private final List<Object> args;
    private final String sqlFile;
    private final Connection connection;

    /**
     * Copy with a different statement.
     *
     * @param sql SQL text
     * @param args positional arguments
     * @return new invocation
     */
    public QueryInvocation withStatement(String sql, List<Object> args) {
        return toBuilder().sql(sql).args(args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of()).build();
    }

    /**
     * Copy bound to a connection.
     *
     * @param connection connection to run on
     * @return new invocation
     */
    public QueryInvocation withConnection(Connection connection) {
        return toBuilder().connection(connection).build();
    }
}
