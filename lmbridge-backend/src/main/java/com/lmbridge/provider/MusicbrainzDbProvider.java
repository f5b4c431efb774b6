package com.lmbridge.provider;

import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.hooks.SqlFileContext;
import com.lmbridge.intercept.QueryInvocation;
import com.lmbridge.intercept.QueryPipeline;
import com.lmbridge.pool.PoolFactory;
import com.lmbridge.pool.PoolSettings;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Provider backed by a MusicBrainz PostgreSQL mirror.
 *
 * <p>Every query goes through the {@link QueryPipeline}. {@link #queryFromFile} binds the
 * template name in the {@link SqlFileContext} for the duration of the call, so the pipeline and
 * the db hooks know which template is executing.
 */
@Slf4j
@Service
public class MusicbrainzDbProvider implements DatabaseProvider {

    public static final String NAME = "MusicbrainzDbProvider";

    private final QueryPipeline pipeline;
    private final SqlTemplateLoader templateLoader;
    private final SqlFileContext sqlFileContext;
    private final PoolFactory poolFactory;
    private final PoolSettings settings;

    private volatile DataSource defaultPool;

    /**
     * Create the provider.
     *
     * @param pipeline query pipeline
     * @param templateLoader SQL template loader
     * @param sqlFileContext template context
     * @param poolFactory pool factory for the default pool
     * @param environment bridge environment
     */
    public MusicbrainzDbProvider(
            QueryPipeline pipeline,
            SqlTemplateLoader templateLoader,
            SqlFileContext sqlFileContext,
            PoolFactory poolFactory,
            BridgeEnvironment environment
    ) {
        this.pipeline = pipeline;
        this.templateLoader = templateLoader;
        this.sqlFileContext = sqlFileContext;
        this.poolFactory = poolFactory;
        this.settings = PoolSettings.builder()
                .poolName("lmbridge-default")
                .host(environment.getOrDefault("db", "lmbridge.musicbrainz.db-host", "MB_DB_HOST"))
                .port(environment.getInt(5432, "lmbridge.musicbrainz.db-port", "MB_DB_PORT"))
                .user(environment.getOrDefault("musicbrainz", "lmbridge.musicbrainz.db-user", "MB_DB_USER"))
                .password(environment.getOrDefault("musicbrainz", "lmbridge.musicbrainz.db-password", "MB_DB_PASSWORD"))
                .database(environment.getOrDefault("musicbrainz_db", "lmbridge.musicbrainz.db-name", "MB_DB_NAME"))
                .maximumPoolSize(environment.getInt(10, "lmbridge.musicbrainz.pool-size", "MB_DB_POOL_SIZE"))
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DataSource getDefaultPool() throws SQLException {
        DataSource pool = defaultPool;
        if (pool != null) {
            return pool;
        }
        synchronized (this) {
            if (defaultPool == null) {
                defaultPool = poolFactory.create(settings);
            }
            return defaultPool;
        }
    }

    @Override
    public PoolSettings getDefaultPoolSettings() {
        return settings;
    }

    /**
     * Run a SQL template from {@code classpath:sql/}.
     *
     * @param sqlFile template file name
     * @param args positional arguments
     * @return rows after all interceptors
     * @throws SQLException on database errors
     */
    public List<Map<String, Object>> queryFromFile(String sqlFile, Object... args) throws SQLException {
        SqlFileContext.Token token = sqlFileContext.set(sqlFile);
        try {
            String sql = templateLoader.load(sqlFile);
            return mapQuery(sql, args != null ? new ArrayList<>(Arrays.asList(args)) : List.of(), null);
        } finally {
            sqlFileContext.reset(token);
        }
    }

    /**
     * Run SQL text.
     *
     * @param sql SQL text with positional {@code ?} parameters
     * @param args positional arguments
     * @param conn connection to run on, or null to use the default pool
     * @return rows after all interceptors
     * @throws SQLException on database errors
     */
    public List<Map<String, Object>> mapQuery(String sql, List<Object> args, Connection conn) throws SQLException {
        QueryInvocation invocation = QueryInvocation.builder()
                .provider(this)
                .sql(sql)
                .args(args != null ? args : List.of())
                .sqlFile(sqlFileContext.get())
                .connection(conn)
                .build();
        return pipeline.execute(invocation);
    }

    @PreDestroy
    public void close() {
        DataSource pool = defaultPool;
        if (pool instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close default MusicBrainz pool", e);
            }
        }
    }
}
