package com.lmbridge.album;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmbridge.filter.ReleaseFilterEngine;
import com.lmbridge.provider.MusicbrainzDbProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Looks up release-group documents, serving repeat lookups from the {@link AlbumCache}.
 */
@Slf4j
@Service
public class ReleaseGroupService {

    private final MusicbrainzDbProvider provider;
    private final AlbumCache cache;
    private final CacheStatusTracker cacheStatus;
    private final ReleaseFilterEngine filterEngine;
    private final ObjectMapper objectMapper;

    public ReleaseGroupService(
            MusicbrainzDbProvider provider,
            AlbumCache cache,
            CacheStatusTracker cacheStatus,
            ReleaseFilterEngine filterEngine,
            ObjectMapper objectMapper
    ) {
        this.provider = provider;
        this.cache = cache;
        this.cacheStatus = cacheStatus;
        this.filterEngine = filterEngine;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a release group by MBID.
     *
     * @param mbid release-group MBID
     * @return release-group document with the current release filter applied
     * @throws SQLException on database errors
     * @throws IllegalArgumentException if {@code mbid} is not a UUID
     * @throws ReleaseGroupNotFoundException if no release group matches
     */
    public JsonNode getReleaseGroup(String mbid) throws SQLException {
        String key = normalizeMbid(mbid);

        Optional<JsonNode> cached = cache.get(key);
        cacheStatus.record(cached.isPresent());
        if (cached.isPresent()) {
            JsonNode doc = cached.get();
            filterEngine.applyReleaseGroupFilters(doc);
            return doc;
        }

        List<Map<String, Object>> rows = provider.queryFromFile(ReleaseFilterEngine.RELEASE_GROUP_SQL_FILE, key);
        if (rows == null || rows.isEmpty() || rows.get(0) == null) {
            throw new ReleaseGroupNotFoundException(key);
        }
        JsonNode doc = toJson(rows.get(0).get("album"));
        if (doc == null || !doc.isObject()) {
            throw new ReleaseGroupNotFoundException(key);
        }
        cache.put(key, doc);
        return doc;
    }

    private JsonNode toJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            try {
                return objectMapper.readTree(s);
            } catch (JsonProcessingException e) {
                log.warn("Release group document is not valid JSON", e);
                return null;
            }
        }
        return objectMapper.valueToTree(value);
    }

    static String normalizeMbid(String mbid) {
        if (mbid == null || mbid.isBlank()) {
            throw new IllegalArgumentException("mbid is required");
        }
        try {
            return UUID.fromString(mbid.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid mbid: " + mbid);
        }
    }
}
