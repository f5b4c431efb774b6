package com.lmbridge.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmbridge.hooks.DbHook;
import com.lmbridge.hooks.QueryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Built-in db hook that filters and ranks the releases of a release-group document.
 *
 * <p>Only results of {@value #RELEASE_GROUP_SQL_FILE} are touched. Each row carries the
 * release group as JSON in its {@code album} column; the release list is narrowed by the
 * include tokens (or, when none, by the exclude tokens) and optionally trimmed to the best
 * ranked releases.
 */
@Slf4j
@Component
public class ReleaseFilterEngine implements DbHook {

    public static final String RELEASE_GROUP_SQL_FILE = "release_group_by_id.sql";

    static final String ALBUM_COLUMN = "album";

    private final ReleaseFilterSettings settings;
    private final ObjectMapper objectMapper;

    /**
     * Create the engine.
     *
     * @param settings runtime filter settings
     * @param objectMapper JSON mapper
     */
    public ReleaseFilterEngine(ReleaseFilterSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Map<String, Object>> afterQuery(List<Map<String, Object>> results, QueryContext context) {
        if (context == null || !RELEASE_GROUP_SQL_FILE.equals(context.getSqlFile())) {
            return null;
        }
        FilterPass pass = snapshot();
        if (!pass.isActive()) {
            return null;
        }
        if (results == null) {
            return null;
        }

        List<Map<String, Object>> out = new ArrayList<>(results.size());
        int rewritten = 0;
        for (Map<String, Object> row : results) {
            Map<String, Object> filtered = filterRow(row, pass);
            if (filtered != row) {
                rewritten++;
            }
            out.add(filtered);
        }
        log.debug("Release filter: rewrote {} of {} rows", rewritten, results.size());
        return out;
    }

    /**
     * Apply the current filters to a release-group document in place.
     *
     * @param releaseGroup album document
     * @return true if the document had a release list and filters were active
     */
    public boolean applyReleaseGroupFilters(JsonNode releaseGroup) {
        if (!(releaseGroup instanceof ObjectNode album)) {
            return false;
        }
        FilterPass pass = snapshot();
        if (!pass.isActive()) {
            return false;
        }
        return pass.apply(album);
    }

    private FilterPass snapshot() {
        Integer keepOnly = settings.getKeepOnlyCount();
        return new FilterPass(
                orEmpty(settings.getIncludeTokens()),
                orEmpty(settings.getExcludeTokens()),
                keepOnly != null ? keepOnly : 0,
                settings.getPriorityTokens()
        );
    }

    private Map<String, Object> filterRow(Map<String, Object> row, FilterPass pass) {
        if (row == null) {
            return null;
        }
        Object value = row.get(ALBUM_COLUMN);
        if (value == null) {
            return row;
        }

        JsonNode album;
        try {
            if (value instanceof String s) {
                if (s.isBlank()) {
                    return row;
                }
                album = objectMapper.readTree(s);
            } else {
                album = objectMapper.valueToTree(value);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Release filter: album column is not JSON, row left unchanged");
            return row;
        }
        if (!(album instanceof ObjectNode albumObject)) {
            return row;
        }

        pass.apply(albumObject);

        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(albumObject);
        } catch (JsonProcessingException e) {
            log.warn("Release filter: cannot serialise filtered album, row left unchanged", e);
            return row;
        }
        Map<String, Object> copy = new LinkedHashMap<>(row);
        copy.put(ALBUM_COLUMN, serialized);
        return copy;
    }

    private static List<String> orEmpty(List<String> tokens) {
        return tokens != null ? tokens : List.of();
    }

    /**
     * One filter run over a consistent view of the settings.
     */
    private static final class FilterPass {

        private final List<String> include;
        private final List<String> exclude;
        private final int keepOnly;
        private final List<String> priority;

        FilterPass(List<String> include, List<String> exclude, int keepOnly, List<String> priority) {
            this.include = include;
            this.exclude = exclude;
            this.keepOnly = keepOnly;
            this.priority = priority;
        }

        boolean isActive() {
            return !include.isEmpty() || !exclude.isEmpty() || keepOnly > 0;
        }

        boolean apply(ObjectNode album) {
            String key = album.has("Releases") ? "Releases" : album.has("releases") ? "releases" : null;
            if (key == null || !album.get(key).isArray()) {
                return false;
            }

            List<JsonNode> releases = new ArrayList<>();
            album.get(key).forEach(releases::add);

            List<JsonNode> current = releases;
            if (!include.isEmpty()) {
                current = select(releases, include, true);
            } else if (!exclude.isEmpty()) {
                List<JsonNode> kept = select(releases, exclude, false);
                // never exclude every release
                if (!kept.isEmpty()) {
                    current = kept;
                }
            }

            if (keepOnly > 0 && current.size() > keepOnly) {
                List<JsonNode> ranked = new ArrayList<>(current);
                ranked.sort(Comparator
                        .comparingInt((JsonNode r) -> rank(formatsOf(r), priority))
                        .thenComparing(r -> String.join(",", new TreeSet<>(formatsOf(r)))));
                current = ranked.subList(0, keepOnly);
            }

            ArrayNode replacement = album.arrayNode();
            current.forEach(replacement::add);
            album.set(key, replacement);
            return true;
        }

        private static List<JsonNode> select(List<JsonNode> releases, List<String> tokens, boolean matching) {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode release : releases) {
                if (matchesAny(formatsOf(release), tokens) == matching) {
                    out.add(release);
                }
            }
            return out;
        }
    }

    static List<String> formatsOf(JsonNode release) {
        List<String> formats = new ArrayList<>();
        if (release == null || !release.isObject()) {
            return formats;
        }
        JsonNode media = release.has("Media") ? release.get("Media") : release.get("media");
        if (media == null || !media.isArray()) {
            return formats;
        }
        for (JsonNode medium : media) {
            JsonNode format = medium != null ? medium.get("Format") : null;
            if (format == null || format.isNull() || format.isContainerNode()) {
                continue;
            }
            String text = format.asText();
            if (!text.isEmpty()) {
                formats.add(text.toLowerCase(Locale.ROOT));
            }
        }
        return formats;
    }

    static boolean matchesAny(List<String> formats, List<String> tokens) {
        for (String format : formats) {
            for (String token : tokens) {
                if (format.contains(token)) {
                    return true;
                }
            }
        }
        return false;
    }

    static int rank(List<String> formats, List<String> priority) {
        if (priority.isEmpty()) {
            return 0;
        }
        int best = priority.size() + 1;
        for (String format : formats) {
            for (int i = 0; i < priority.size() && i < best; i++) {
                if (format.contains(priority.get(i))) {
                    best = i;
                }
            }
        }
        return best;
    }
}
