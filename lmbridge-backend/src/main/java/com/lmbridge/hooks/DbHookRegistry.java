package com.lmbridge.hooks;

import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.pool.PoolRouter;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the built-in and the custom {@link DbHook} and runs them around each query.
 *
 * <p>Order is fixed: the built-in hook runs first in both phases, then the custom hook. Every
 * stage fails open, so a broken hook degrades to a pass-through instead of failing the query.
 */
@Slf4j
@Component
public class DbHookRegistry {

    private static final String LABEL = "DB hooks";

    private final DbHook builtinHook;
    private final HookLoader hookLoader;
    private final BridgeEnvironment environment;

    private volatile DbHook customHook;
    private volatile boolean customLoadAttempted;

    /**
     * Create a hook registry.
     *
     * @param builtinHook built-in hook (the release filter engine)
     * @param hookLoader plugin loader
     * @param environment bridge environment
     */
    @Autowired
    public DbHookRegistry(DbHook builtinHook, HookLoader hookLoader, BridgeEnvironment environment) {
        this.builtinHook = builtinHook;
        this.hookLoader = hookLoader;
        this.environment = environment;
    }

    DbHookRegistry(DbHook builtinHook, DbHook customHook) {
        this.builtinHook = builtinHook;
        this.hookLoader = null;
        this.environment = null;
        this.customHook = customHook;
        this.customLoadAttempted = true;
    }

    /**
     * Resolve the custom hook once. A failure is permanent for the life of the process.
     */
    @PostConstruct
    public synchronized void init() {
        if (customLoadAttempted) {
            return;
        }
        customLoadAttempted = true;

        String className = environment.getTrimmed(
                "lmbridge.db-hooks.class", "LMBRIDGE_DB_HOOK_AFTER_MODULE", "LMBRIDGE_DB_HOOK_MODULE");
        String path = environment.getTrimmed(
                "lmbridge.db-hooks.path", "LMBRIDGE_DB_HOOK_AFTER_PATH", "LMBRIDGE_DB_HOOK_PATH");

        if (builtinHook != null && builtinHook.getClass().getName().equals(className) && path == null) {
            log.warn("LM-Bridge DB hooks: {} is built-in and applied automatically; "
                    + "use LMBRIDGE_DB_HOOK_AFTER_MODULE for custom hooks.", className);
            return;
        }

        DbHook loaded = hookLoader.load(DbHook.class, className, path, LABEL).orElse(null);
        if (loaded == null) {
            return;
        }
        if (!overrides(loaded, "beforeQuery", String.class, List.class, QueryContext.class)
                && !overrides(loaded, "afterQuery", List.class, QueryContext.class)) {
            log.error("LM-Bridge DB hooks: {} must override beforeQuery(sql, args, context) or "
                    + "afterQuery(results, context)", loaded.getClass().getName());
            return;
        }
        customHook = loaded;
    }

    /**
     * Run the before-query stages.
     *
     * @param sql SQL text
     * @param args positional arguments
     * @param context query context, updated after each stage
     * @return final SQL, arguments and pool key (never null; pool key defaults to "default")
     */
    public BeforeQueryResult applyBefore(String sql, List<Object> args, QueryContext context) {
        BeforeQueryResult current = BeforeQueryResult.of(sql, args != null ? args : List.of(), PoolRouter.DEFAULT_POOL);
        current = applyBeforeStage(builtinHook, "built-in", current, context);
        current = applyBeforeStage(customHook, "custom", current, context);
        return current;
    }

    /**
     * Run the after-query stages.
     *
     * @param results rows returned by the query
     * @param context query context
     * @return rows after all stages
     */
    public List<Map<String, Object>> applyAfter(List<Map<String, Object>> results, QueryContext context) {
        List<Map<String, Object>> current = results;
        for (DbHook hook : new DbHook[]{builtinHook, customHook}) {
            if (hook == null) {
                continue;
            }
            List<Map<String, Object>> updated;
            try {
                updated = hook.afterQuery(current, context);
            } catch (Exception e) {
                log.error("LM-Bridge DB hooks: after_query failed in {}", hook.getClass().getName(), e);
                continue;
            }
            if (updated != null) {
                current = updated;
            }
        }
        return current;
    }

    /**
     * Describe the active hooks.
     *
     * @return map with built-in and custom hook class names (null when absent)
     */
    public Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("builtin", builtinHook != null ? builtinHook.getClass().getName() : null);
        DbHook custom = customHook;
        m.put("custom", custom != null ? custom.getClass().getName() : null);
        return m;
    }

    private BeforeQueryResult applyBeforeStage(DbHook hook, String stage, BeforeQueryResult current, QueryContext context) {
        if (hook == null) {
            return current;
        }

        BeforeQueryResult result;
        try {
            result = hook.beforeQuery(current.getSql(), new ArrayList<>(current.getArgs()), context);
        } catch (Exception e) {
            log.error("LM-Bridge DB hooks: {} before_query failed", stage, e);
            return current;
        }

        if (result == null) {
            return current;
        }
        if (!result.isWellFormed()) {
            log.error("LM-Bridge DB hooks: {} before_query must return sql and args or null, got {}", stage, result);
            return current;
        }

        String poolKey = result.getPoolKey() != null && !result.getPoolKey().isBlank()
                ? result.getPoolKey().trim()
                : current.getPoolKey();
        BeforeQueryResult next = BeforeQueryResult.of(result.getSql(), result.getArgs(), poolKey);
        if (context != null) {
            context.setSql(next.getSql());
            context.setArgs(next.getArgs());
            context.setPoolKey(next.getPoolKey());
        }
        return next;
    }

    private static boolean overrides(Object target, String name, Class<?>... parameterTypes) {
        try {
            Method m = target.getClass().getMethod(name, parameterTypes);
            return m.getDeclaringClass() != DbHook.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
