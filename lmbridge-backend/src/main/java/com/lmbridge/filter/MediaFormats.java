package com.lmbridge.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Media format vocabulary used by the release filter.
 *
 * <p>Tokens are lower-case substrings matched against MusicBrainz medium format names
 * ({@code "12\" Vinyl"}, {@code "Digital Media"}, {@code "Hybrid SACD"} ...). Matching is
 * deliberately coarse: {@code "vinyl"} matches every vinyl size and {@code "cd"} matches SACD
 * and HDCD as well.
 */
public final class MediaFormats {

    /**
     * Alias token to the canonical tokens it stands for, in expansion order.
     */
    public static final Map<String, List<String>> ALIASES;

    /**
     * Ranking used by keep-only trimming when digital releases are preferred (the default).
     */
    public static final List<String> PRIORITY_DIGITAL_FIRST = List.of(
            "digital media", "cd", "sacd", "dvd", "blu-ray",
            "cassette", "reel-to-reel", "8-track cartridge",
            "vinyl", "flexi-disc", "shellac"
    );

    /**
     * Ranking used by keep-only trimming when analog releases are preferred.
     */
    public static final List<String> PRIORITY_ANALOG_FIRST = List.of(
            "vinyl", "flexi-disc", "shellac",
            "cassette", "reel-to-reel", "8-track cartridge",
            "cd", "sacd", "dvd", "blu-ray", "digital media"
    );

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("digital", List.of("digital media"));
        m.put("download", List.of("digital media"));
        m.put("vinyl", List.of("vinyl", "flexi-disc"));
        m.put("record", List.of("vinyl", "flexi-disc", "shellac"));
        m.put("tape", List.of("cassette", "reel-to-reel", "8-track cartridge", "dat", "dcc"));
        m.put("analog", List.of("vinyl", "flexi-disc", "shellac", "cassette", "reel-to-reel", "8-track cartridge", "wax cylinder"));
        m.put("video", List.of("dvd-video", "blu-ray", "vhs", "laserdisc", "vcd", "umd"));
        ALIASES = Collections.unmodifiableMap(m);
    }

    private MediaFormats() {
    }

    /**
     * Parse a token list from a configuration value.
     *
     * Accepts a comma-separated string, a collection, or an array. Tokens are trimmed and
     * lower-cased; blanks are dropped.
     *
     * @param raw configuration value
     * @return tokens, or null when {@code raw} is null
     */
    public static List<String> parseTokens(Object raw) {
        if (raw == null) {
            return null;
        }
        List<String> tokens = new ArrayList<>();
        if (raw instanceof String s) {
            for (String part : s.split(",")) {
                addToken(tokens, part);
            }
        } else if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) {
                    addToken(tokens, String.valueOf(value));
                }
            }
        } else if (raw instanceof Object[] values) {
            for (Object value : values) {
                if (value != null) {
                    addToken(tokens, String.valueOf(value));
                }
            }
        } else {
            addToken(tokens, String.valueOf(raw));
        }
        return tokens;
    }

    /**
     * Replace alias tokens by their canonical tokens and drop duplicates, keeping first-seen order.
     * Unknown tokens pass through unchanged.
     *
     * @param tokens normalised tokens
     * @return expanded tokens
     */
    public static List<String> expandAliases(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        Set<String> expanded = new LinkedHashSet<>();
        for (String token : tokens) {
            List<String> mapped = ALIASES.get(token);
            if (mapped != null && !mapped.isEmpty()) {
                expanded.addAll(mapped);
            } else {
                expanded.add(token);
            }
        }
        return List.copyOf(expanded);
    }

    private static void addToken(List<String> tokens, String value) {
        String token = value.trim().toLowerCase(Locale.ROOT);
        if (!token.isEmpty()) {
            tokens.add(token);
        }
    }
}
