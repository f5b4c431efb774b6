package com.lmbridge.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmbridge.hooks.QueryContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReleaseFilterEngine")
class ReleaseFilterEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ReleaseFilterSettings settings;
    private ReleaseFilterEngine engine;

    @BeforeEach
    void setUp() {
        settings = new ReleaseFilterSettings(null);
        engine = new ReleaseFilterEngine(settings, mapper);
    }

    private QueryContext releaseGroupContext() {
        return QueryContext.builder()
                .providerName("MusicbrainzDbProvider")
                .sqlFile(ReleaseFilterEngine.RELEASE_GROUP_SQL_FILE)
                .poolKey("default")
                .build();
    }

    private ObjectNode release(String id, String... formats) {
        ObjectNode release = mapper.createObjectNode();
        release.put("Id", id);
        ArrayNode media = release.putArray("Media");
        for (String format : formats) {
            media.addObject().put("Format", format);
        }
        return release;
    }

    private ObjectNode album(ObjectNode... releases) {
        ObjectNode album = mapper.createObjectNode();
        album.put("Id", "rg-1");
        ArrayNode list = album.putArray("Releases");
        for (ObjectNode r : releases) {
            list.add(r);
        }
        return album;
    }

    private List<Map<String, Object>> rows(JsonNode album) throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("album", mapper.writeValueAsString(album));
        row.put("other", 42);
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row);
        return rows;
    }

    private List<String> releaseIds(List<Map<String, Object>> rows) throws Exception {
        JsonNode album = mapper.readTree((String) rows.get(0).get("album"));
        List<String> ids = new ArrayList<>();
        album.get("Releases").forEach(r -> ids.add(r.get("Id").asText()));
        return ids;
    }

    @Nested
    @DisplayName("gating")
    class Gating {

        @Test
        @DisplayName("returns null for other sql files")
        void ignoresOtherSqlFiles() throws Exception {
            settings.setExcludeTokens("vinyl");
            QueryContext ctx = QueryContext.builder().sqlFile("artist_by_id.sql").build();

            assertThat(engine.afterQuery(rows(album(release("a", "Vinyl"))), ctx)).isNull();
        }

        @Test
        @DisplayName("returns null when no filter is configured")
        void noOpWithoutConfiguration() throws Exception {
            settings.setPrefer("analog");

            assertThat(engine.afterQuery(rows(album(release("a", "Vinyl"))), releaseGroupContext())).isNull();
        }

        @Test
        @DisplayName("returns null for a null context")
        void nullContext() throws Exception {
            settings.setExcludeTokens("vinyl");

            assertThat(engine.afterQuery(rows(album(release("a", "Vinyl"))), null)).isNull();
        }
    }

    @Nested
    @DisplayName("row handling")
    class RowHandling {

        @Test
        @DisplayName("passes rows without an album through unchanged")
        void passesRowsWithoutAlbum() {
            settings.setExcludeTokens("vinyl");
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("album", null);
            Map<String, Object> other = new LinkedHashMap<>();
            other.put("id", 1);

            List<Map<String, Object>> out = engine.afterQuery(List.of(row, other), releaseGroupContext());

            assertThat(out).hasSize(2);
            assertThat(out.get(0)).isSameAs(row);
            assertThat(out.get(1)).isSameAs(other);
        }

        @Test
        @DisplayName("passes rows with unparseable album JSON through unchanged")
        void passesUnparseableAlbum() {
            settings.setExcludeTokens("vinyl");
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("album", "{not json");

            List<Map<String, Object>> out = engine.afterQuery(List.of(row), releaseGroupContext());

            assertThat(out.get(0)).isSameAs(row);
        }

        @Test
        @DisplayName("accepts an already structured album value and keeps other columns")
        void acceptsStructuredAlbum() throws Exception {
            settings.setExcludeTokens("vinyl");
            Map<String, Object> structured = mapper.convertValue(
                    album(release("v", "12\" Vinyl"), release("d", "Digital Media")), Map.class);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("album", structured);
            row.put("other", "x");

            List<Map<String, Object>> out = engine.afterQuery(List.of(row), releaseGroupContext());

            assertThat(out.get(0).get("other")).isEqualTo("x");
            assertThat(releaseIds(out)).containsExactly("d");
        }

        @Test
        @DisplayName("handles lower-case releases and media keys")
        void lowerCaseKeys() throws Exception {
            settings.setIncludeTokens("cd");
            String json = "{\"releases\":[{\"Id\":\"a\",\"media\":[{\"Format\":\"CD\"}]},"
                    + "{\"Id\":\"b\",\"media\":[{\"Format\":\"Vinyl\"}]}]}";
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("album", json);

            List<Map<String, Object>> out = engine.afterQuery(List.of(row), releaseGroupContext());

            JsonNode album = mapper.readTree((String) out.get(0).get("album"));
            assertThat(album.has("Releases")).isFalse();
            assertThat(album.get("releases")).hasSize(1);
            assertThat(album.get("releases").get(0).get("Id").asText()).isEqualTo("a");
        }

        @Test
        @DisplayName("serialises the album compactly")
        void compactSerialisation() throws Exception {
            settings.setExcludeTokens("vinyl");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("v", "Vinyl"), release("c", "CD"))), releaseGroupContext());

            assertThat((String) out.get(0).get("album")).doesNotContain(" ").doesNotContain("\n");
        }
    }

    @Nested
    @DisplayName("include and exclude")
    class IncludeExclude {

        @Test
        @DisplayName("exclusion drops matching releases")
        void exclusionDropsMatching() throws Exception {
            settings.setExcludeTokens(List.of("vinyl"));

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("v", "Vinyl"), release("d", "Digital Media"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("d");
        }

        @Test
        @DisplayName("exclusion never empties a non-empty release list")
        void exclusionNeverEmpties() throws Exception {
            settings.setExcludeTokens(List.of("vinyl"));

            List<Map<String, Object>> out = engine.afterQuery(rows(album(release("v", "Vinyl"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("v");
        }

        @Test
        @DisplayName("inclusion may empty the release list")
        void inclusionMayEmpty() throws Exception {
            settings.setIncludeTokens("cassette");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("v", "Vinyl"), release("c", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).isEmpty();
        }

        @Test
        @DisplayName("inclusion takes precedence over exclusion")
        void inclusionWins() throws Exception {
            settings.setIncludeTokens("vinyl");
            settings.setExcludeTokens("vinyl");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("v", "7\" Vinyl"), release("c", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("v");
        }

        @Test
        @DisplayName("matching is a case-insensitive substring match on any medium")
        void substringMatch() throws Exception {
            settings.setIncludeTokens("VINYL");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("mixed", "CD", "12\" Vinyl"), release("c", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("mixed");
        }

        @Test
        @DisplayName("alias tokens expand before matching")
        void aliasExpansion() throws Exception {
            settings.setIncludeTokens("digital");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("d", "Digital Media"), release("c", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("d");
        }

        @Test
        @DisplayName("releases without media never match include tokens")
        void releasesWithoutMedia() throws Exception {
            settings.setIncludeTokens("cd");
            ObjectNode bare = mapper.createObjectNode().put("Id", "bare");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(bare, release("c", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("c");
        }
    }

    @Nested
    @DisplayName("keep-only ranking")
    class KeepOnly {

        @Test
        @DisplayName("prefers digital formats by default")
        void digitalFirstByDefault() throws Exception {
            settings.setKeepOnlyCount(2);

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("vinyl", "Vinyl"), release("cd", "CD"), release("tape", "Cassette"))),
                    releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("cd", "tape");
        }

        @Test
        @DisplayName("prefers analog formats when asked")
        void analogFirst() throws Exception {
            settings.setKeepOnlyCount(1);
            settings.setPrefer("analog");

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("cd", "CD"), release("vinyl", "12\" Vinyl"), release("web", "Digital Media"))),
                    releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("vinyl");
        }

        @Test
        @DisplayName("breaks rank ties by the sorted format set")
        void tieBreakByFormats() throws Exception {
            settings.setKeepOnlyCount(2);

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(
                            release("b", "CD", "DVD-Video"),
                            release("a", "CD", "CD"),
                            release("c", "Vinyl"))),
                    releaseGroupContext());

            // "cd" sorts before "cd,dvd-video"; duplicate formats collapse
            assertThat(releaseIds(out)).containsExactly("a", "b");
        }

        @Test
        @DisplayName("leaves lists within the limit untouched")
        void withinLimit() throws Exception {
            settings.setKeepOnlyCount(3);

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("vinyl", "Vinyl"), release("cd", "CD"))), releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("vinyl", "cd");
        }

        @Test
        @DisplayName("ranks releases without a matching token last")
        void unmatchedRankLast() {
            int rank = ReleaseFilterEngine.rank(List.of("wax cylinder"), MediaFormats.PRIORITY_DIGITAL_FIRST);

            assertThat(rank).isEqualTo(MediaFormats.PRIORITY_DIGITAL_FIRST.size() + 1);
            assertThat(ReleaseFilterEngine.rank(List.of("cd"), List.of())).isZero();
        }

        @Test
        @DisplayName("applies after exclusion")
        void afterExclusion() throws Exception {
            settings.setExcludeTokens("cd");
            settings.setKeepOnlyCount(1);

            List<Map<String, Object>> out = engine.afterQuery(
                    rows(album(release("vinyl", "Vinyl"), release("cd", "CD"), release("tape", "Cassette"))),
                    releaseGroupContext());

            assertThat(releaseIds(out)).containsExactly("tape");
        }
    }

    @Test
    @DisplayName("is idempotent under unchanged configuration")
    void idempotent() throws Exception {
        settings.setExcludeTokens("vinyl");
        settings.setKeepOnlyCount(2);
        List<Map<String, Object>> input = rows(album(
                release("v", "Vinyl"), release("c", "CD"), release("t", "Cassette"), release("d", "Digital Media")));

        List<Map<String, Object>> once = engine.afterQuery(input, releaseGroupContext());
        List<Map<String, Object>> twice = engine.afterQuery(once, releaseGroupContext());

        assertThat(twice.get(0).get("album")).isEqualTo(once.get(0).get("album"));
    }

    @Test
    @DisplayName("does not mutate the input rows")
    void doesNotMutateInput() throws Exception {
        settings.setExcludeTokens("vinyl");
        List<Map<String, Object>> input = rows(album(release("v", "Vinyl"), release("c", "CD")));
        Object before = input.get(0).get("album");

        engine.afterQuery(input, releaseGroupContext());

        assertThat(input.get(0).get("album")).isSameAs(before);
    }

    @Test
    @DisplayName("filters a release-group document in place")
    void appliesToDocument() {
        settings.setIncludeTokens("cd");
        ObjectNode doc = album(release("v", "Vinyl"), release("c", "CD"));

        boolean applied = engine.applyReleaseGroupFilters(doc);

        assertThat(applied).isTrue();
        assertThat(doc.get("Releases")).hasSize(1);
        assertThat(engine.applyReleaseGroupFilters(mapper.createArrayNode())).isFalse();
    }
}
