package com.lmbridge.album;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmbridge.config.BridgeEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache of release-group documents keyed by MBID.
 *
 * Expired entries are dropped on access. {@link #expireAll()} keeps entries but marks them
 * expired, {@link #clear()} drops them.
 */
@Slf4j
@Component
public class AlbumCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public AlbumCache(BridgeEnvironment environment) {
        this(Duration.ofSeconds(environment.getInt(3600, "lmbridge.album-cache.ttl-seconds", "LMBRIDGE_ALBUM_CACHE_TTL")),
                Clock.systemUTC());
    }

    AlbumCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<JsonNode> get(String mbid) {
        Entry entry = entries.get(mbid);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt.isAfter(clock.instant())) {
            entries.remove(mbid, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value.deepCopy());
    }

    /**
     * Cache a document. Null and empty documents are not cached.
     *
     * @param mbid release-group MBID
     * @param value document
     */
    public void put(String mbid, JsonNode value) {
        if (mbid == null || value == null || value.isNull() || value.isEmpty()) {
            return;
        }
        entries.put(mbid, new Entry(value.deepCopy(), clock.instant().plus(ttl)));
    }

    /**
     * Remove every entry.
     *
     * @return number of removed entries
     */
    public int clear() {
        int count = entries.size();
        entries.clear();
        log.info("Album cache cleared ({} entries)", count);
        return count;
    }

    /**
     * Mark every entry as expired.
     *
     * @return number of expired entries
     */
    public int expireAll() {
        Instant now = clock.instant();
        int count = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (entries.replace(e.getKey(), e.getValue(), new Entry(e.getValue().value, now))) {
                count++;
            }
        }
        log.info("Album cache expired ({} entries)", count);
        return count;
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final JsonNode value;
        private final Instant expiresAt;

        Entry(JsonNode value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
