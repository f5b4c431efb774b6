package com.lmbridge.provider;

import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.filter.ReleaseFilterEngine;
import com.lmbridge.hooks.SqlFileContext;
import com.lmbridge.intercept.QueryInvocation;
import com.lmbridge.intercept.QueryPipeline;
import com.lmbridge.pool.PoolFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("MusicbrainzDbProvider")
class MusicbrainzDbProviderTest {

    private final SqlFileContext sqlFileContext = new SqlFileContext();
    private final SqlTemplateLoader templateLoader = new SqlTemplateLoader();

    private MusicbrainzDbProvider provider(QueryPipeline pipeline, PoolFactory factory, MockEnvironment env) {
        return new MusicbrainzDbProvider(pipeline, templateLoader, sqlFileContext, factory, new BridgeEnvironment(env));
    }

    @Nested
    @DisplayName("settings")
    class Settings {

        @Test
        @DisplayName("uses MusicBrainz defaults")
        void defaults() {
            MusicbrainzDbProvider p = provider(new QueryPipeline(List.of(), inv -> List.of()), s -> null, new MockEnvironment());

            assertThat(p.getDefaultPoolSettings().getHost()).isEqualTo("db");
            assertThat(p.getDefaultPoolSettings().getPort()).isEqualTo(5432);
            assertThat(p.getDefaultPoolSettings().getUser()).isEqualTo("musicbrainz");
            assertThat(p.getDefaultPoolSettings().getDatabase()).isEqualTo("musicbrainz_db");
        }

        @Test
        @DisplayName("reads MB_DB_* overrides")
        void overrides() {
            MockEnvironment env = new MockEnvironment()
                    .withProperty("MB_DB_HOST", "mirror")
                    .withProperty("MB_DB_PORT", "6543")
                    .withProperty("MB_DB_NAME", "mb");

            MusicbrainzDbProvider p = provider(new QueryPipeline(List.of(), inv -> List.of()), s -> null, env);

            assertThat(p.getDefaultPoolSettings().toJdbcUrl()).isEqualTo("jdbc:postgresql://mirror:6543/mb");
        }

        @Test
        @DisplayName("creates the default pool once")
        void defaultPoolOnce() throws SQLException {
            AtomicInteger created = new AtomicInteger();
            DataSource ds = mock(DataSource.class);
            MusicbrainzDbProvider p = provider(new QueryPipeline(List.of(), inv -> List.of()), s -> {
                created.incrementAndGet();
                return ds;
            }, new MockEnvironment());

            assertThat(p.getDefaultPool()).isSameAs(ds);
            assertThat(p.getDefaultPool()).isSameAs(ds);
            assertThat(created).hasValue(1);
        }
    }

    @Test
    @DisplayName("binds the template name while the query runs and restores it afterwards")
    void bindsTemplateName() throws SQLException {
        QueryPipeline pipeline = new QueryPipeline(List.of(), inv -> List.of(Map.of("file", inv.getSqlFile(), "sql", inv.getSql())));
        MusicbrainzDbProvider p = provider(pipeline, s -> null, new MockEnvironment());

        List<Map<String, Object>> rows = p.queryFromFile("echo.sql", "x");

        assertThat(rows.get(0).get("file")).isEqualTo("echo.sql");
        assertThat((String) rows.get(0).get("sql")).contains("SELECT ? AS echo");
        assertThat(sqlFileContext.get()).isNull();
    }

    @Test
    @DisplayName("restores the template binding when the query fails")
    void restoresOnFailure() {
        QueryPipeline pipeline = new QueryPipeline(List.of(), inv -> {
            throw new SQLException("down");
        });
        MusicbrainzDbProvider p = provider(pipeline, s -> null, new MockEnvironment());

        assertThatThrownBy(() -> p.queryFromFile("echo.sql", "x")).isInstanceOf(SQLException.class);
        assertThat(sqlFileContext.get()).isNull();
    }

    @Test
    @DisplayName("rejects unknown templates")
    void unknownTemplate() {
        MusicbrainzDbProvider p = provider(new QueryPipeline(List.of(), inv -> List.of()), s -> null, new MockEnvironment());

        assertThatThrownBy(() -> p.queryFromFile("missing.sql")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> p.queryFromFile("../secret.sql")).isInstanceOf(IllegalArgumentException.class);
        assertThat(sqlFileContext.get()).isNull();
    }

    @Test
    @DisplayName("keeps overlapping queries on different threads isolated")
    void overlappingQueries() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        QueryPipeline pipeline = new QueryPipeline(List.of(), inv -> {
            bothRunning.countDown();
            try {
                bothRunning.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(Map.of("file", sqlFileContext.get()));
        });
        MusicbrainzDbProvider p = provider(pipeline, s -> null, new MockEnvironment());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<List<Map<String, Object>>> a = executor.submit(() -> p.queryFromFile("echo.sql", 1));
            Future<List<Map<String, Object>>> b = executor.submit(() -> p.queryFromFile(
                    ReleaseFilterEngine.RELEASE_GROUP_SQL_FILE, "x"));

            assertThat(a.get(5, TimeUnit.SECONDS).get(0).get("file")).isEqualTo("echo.sql");
            assertThat(b.get(5, TimeUnit.SECONDS).get(0).get("file")).isEqualTo("release_group_by_id.sql");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("runs raw SQL without a template name")
    void mapQueryWithoutTemplate() throws SQLException {
        QueryPipeline pipeline = new QueryPipeline(List.of(), QueryInvocationEcho::echo);
        MusicbrainzDbProvider p = provider(pipeline, s -> null, new MockEnvironment());

        List<Map<String, Object>> rows = p.mapQuery("select 1", null, null);

        assertThat(rows.get(0)).containsEntry("file", "none");
    }

    private static final class QueryInvocationEcho {
        static List<Map<String, Object>> echo(QueryInvocation inv) {
            return List.of(Map.of("file", inv.getSqlFile() != null ? inv.getSqlFile() : "none"));
        }
    }
}
