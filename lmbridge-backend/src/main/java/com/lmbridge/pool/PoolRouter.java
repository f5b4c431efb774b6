package com.lmbridge.pool;

import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.provider.DatabaseProvider;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves pool keys to connection pools.
 *
 * <p>{@value #DEFAULT_POOL} always maps to the provider's own pool. Any other key maps to a
 * secondary pool configured through {@code LMBRIDGE_DB_POOL_<KEY>_HOST}, {@code _PORT},
 * {@code _USER}, {@code _PASSWORD} and {@code _DB_NAME}. Secondary pools are created on first
 * use, at most once per key, and kept for the life of the process. A missing setting or a
 * failed creation falls back to the default pool for that call.
 */
@Slf4j
@Component
public class PoolRouter {

    public static final String DEFAULT_POOL = "default";

    private final Map<String, Map<String, DataSource>> pools = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final PoolFactory poolFactory;
    private final BridgeEnvironment environment;

    /**
     * Create a pool router.
     *
     * @param poolFactory factory for secondary pools
     * @param environment bridge environment
     */
    public PoolRouter(PoolFactory poolFactory, BridgeEnvironment environment) {
        this.poolFactory = poolFactory;
        this.environment = environment;
    }

    /**
     * Resolve the pool for a key.
     *
     * @param provider provider issuing the query
     * @param poolKey pool key
     * @return pool to run the query on
     * @throws SQLException if the provider's default pool cannot be obtained
     */
    public DataSource getPool(DatabaseProvider provider, String poolKey) throws SQLException {
        if (poolKey == null || poolKey.isBlank() || DEFAULT_POOL.equals(poolKey)) {
            return provider.getDefaultPool();
        }

        Map<String, DataSource> providerPools = pools.computeIfAbsent(provider.getName(), k -> new ConcurrentHashMap<>());
        DataSource existing = providerPools.get(poolKey);
        if (existing != null) {
            return existing;
        }

        ReentrantLock lock = locks.computeIfAbsent(provider.getName() + "/" + poolKey, k -> new ReentrantLock());
        lock.lock();
        try {
            existing = providerPools.get(poolKey);
            if (existing != null) {
                return existing;
            }

            PoolSettings settings = resolveSettings(provider, poolKey);
            if (settings == null) {
                log.error("LM-Bridge DB hooks: pool {} missing HOST or DB_NAME; falling back to default", poolKey);
                return provider.getDefaultPool();
            }

            DataSource created;
            try {
                created = poolFactory.create(settings);
            } catch (Exception e) {
                log.error("LM-Bridge DB hooks: failed to create pool {}", poolKey, e);
                return provider.getDefaultPool();
            }
            if (created == null) {
                log.error("LM-Bridge DB hooks: pool factory returned no pool for {}; falling back to default", poolKey);
                return provider.getDefaultPool();
            }

            providerPools.put(poolKey, created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * List the secondary pool keys created so far for a provider.
     *
     * @param providerName provider name
     * @return pool keys
     */
    public List<String> listPoolKeys(String providerName) {
        Map<String, DataSource> providerPools = pools.get(providerName);
        if (providerPools == null) {
            return List.of();
        }
        return providerPools.keySet().stream().sorted().toList();
    }

    PoolSettings resolveSettings(DatabaseProvider provider, String poolKey) {
        String host = poolValue(poolKey, "HOST");
        String dbName = poolValue(poolKey, "DB_NAME");
        if (host == null || dbName == null) {
            return null;
        }

        PoolSettings defaults = provider.getDefaultPoolSettings();
        int port = defaults.getPort();
        String rawPort = poolValue(poolKey, "PORT");
        if (rawPort != null) {
            try {
                port = Integer.parseInt(rawPort);
            } catch (NumberFormatException ignored) {
                log.warn("LM-Bridge DB hooks: pool {} has invalid PORT '{}'; using {}", poolKey, rawPort, port);
            }
        }
        String user = poolValue(poolKey, "USER");
        String password = poolValue(poolKey, "PASSWORD");

        return defaults.toBuilder()
                .poolName("lmbridge-" + poolKey)
                .host(host)
                .port(port)
                .user(user != null ? user : defaults.getUser())
                .password(password != null ? password : defaults.getPassword())
                .database(dbName)
                .build();
    }

    private String poolValue(String poolKey, String suffix) {
        String key = poolKey.toUpperCase(Locale.ROOT);
        return environment.getTrimmed(
                "lmbridge.db-pool." + poolKey.toLowerCase(Locale.ROOT) + "." + suffix.toLowerCase(Locale.ROOT).replace('_', '-'),
                "LMBRIDGE_DB_POOL_" + key + "_" + suffix
        );
    }

    /**
     * Close every secondary pool.
     */
    @PreDestroy
    public void close() {
        for (Map<String, DataSource> providerPools : pools.values()) {
            for (Map.Entry<String, DataSource> entry : providerPools.entrySet()) {
                if (entry.getValue() instanceof AutoCloseable closeable) {
                    try {
                        closeable.close();
                    } catch (Exception e) {
                        log.warn("Failed to close pool {}", entry.getKey(), e);
                    }
                }
            }
        }
        pools.clear();
    }
}
