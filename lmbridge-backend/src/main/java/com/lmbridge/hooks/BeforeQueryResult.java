package com.lmbridge.hooks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link DbHook#beforeQuery}: the SQL and arguments to run, and optionally the pool to
 * run them on. A {@code null} pool key keeps the pool selected by earlier stages.
 */
public final class BeforeQueryResult {
    private final String sql;
    private final List<Object> args;
    private final String poolKey;

    private BeforeQueryResult(String sql, List<Object> args, String poolKey) {
        this.sql = sql;
        this.args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : null;
        this.poolKey = poolKey;
    }

    /**
     * Rewrite SQL and arguments, keeping the current pool.
     *
     * @param sql SQL text
     * @param args positional arguments
     * @return result
     */
    public static BeforeQueryResult of(String sql, List<Object> args) {
        return new BeforeQueryResult(sql, args, null);
    }

    /**
     * Rewrite SQL and arguments and route to the given pool.
     *
     * @param sql SQL text
     * @param args positional arguments
     * @param poolKey pool key, or null to keep the current pool
     * @return result
     */
    public static BeforeQueryResult of(String sql, List<Object> args, String poolKey) {
        return new BeforeQueryResult(sql, args, poolKey);
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getArgs() {
        return args;
    }

    public String getPoolKey() {
        return poolKey;
    }

    /**
     * A result is well-formed when it carries both SQL text and an argument list.
     *
     * @return true if usable
     */
    public boolean isWellFormed() {
        return sql != null && !sql.isBlank() && args != null;
    }

    @Override
    public String toString() {
        return "BeforeQueryResult{poolKey=" + poolKey + ", args=" + (args != null ? args.size() : "null") + "}";
    }
}
