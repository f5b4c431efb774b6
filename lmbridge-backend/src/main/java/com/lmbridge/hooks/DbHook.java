package com.lmbridge.hooks;

import java.util.List;
import java.util.Map;

/**
 * A pair of callbacks run around every MusicBrainz provider query.
 *
 * <p>Both methods are optional; the defaults return {@code null}, which means "no change".
 * Implementations must be synchronous and thread-safe. Exceptions thrown from either method are
 * logged and the stage is skipped: a failing hook never blocks a query.
 *
 * <p>Operators supply a custom hook by naming its class ({@code LMBRIDGE_DB_HOOK_AFTER_MODULE})
 * and optionally the jar containing it ({@code LMBRIDGE_DB_HOOK_AFTER_PATH}). Classes loaded from
 * a jar without an explicit class name are discovered through
 * {@code META-INF/services/com.lmbridge.hooks.DbHook}. A public no-arg constructor is required.
 */
public interface DbHook {

    /**
     * Called before the query runs.
     *
     * @param sql SQL text after earlier stages
     * @param args positional arguments after earlier stages
     * @param context query context
     * @return rewritten query, or null to leave it unchanged
     */
    default BeforeQueryResult beforeQuery(String sql, List<Object> args, QueryContext context) {
        return null;
    }

    /**
     * Called with the rows returned by the query.
     *
     * @param results rows after earlier stages
     * @param context query context
     * @return replacement rows, or null to pass the rows through
     */
    default List<Map<String, Object>> afterQuery(List<Map<String, Object>> results, QueryContext context) {
        return null;
    }
}
