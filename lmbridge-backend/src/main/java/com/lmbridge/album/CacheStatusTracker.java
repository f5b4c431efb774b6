package com.lmbridge.album;

import org.springframework.stereotype.Component;

/**
 * Records album cache hits and misses for the request on the current thread.
 */
@Component
public class CacheStatusTracker {

    public static final String HIT = "hit";
    public static final String MISS = "miss";
    public static final String MIXED = "mixed";

    private final ThreadLocal<String> status = new ThreadLocal<>();

    /**
     * Record one cache lookup.
     *
     * @param hit whether the lookup was served from the cache
     */
    public void record(boolean hit) {
        String next = hit ? HIT : MISS;
        String current = status.get();
        if (current == null) {
            status.set(next);
        } else if (!current.equals(next)) {
            status.set(MIXED);
        }
    }

    /**
     * @return {@code hit}, {@code miss}, {@code mixed}, or null when no lookup happened
     */
    public String getStatus() {
        return status.get();
    }

    public void reset() {
        status.remove();
    }
}
