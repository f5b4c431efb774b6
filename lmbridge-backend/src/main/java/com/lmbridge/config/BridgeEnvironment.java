package com.lmbridge.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Reads bridge settings from the Spring {@link Environment}.
 *
 * Each setting is looked up as a dotted property first and then under one or more
 * environment-variable style keys, in the given order. Values are trimmed; blank values
 * count as missing.
 */
@Component
public class BridgeEnvironment {

    private final Environment environment;

    /**
     * Create a bridge environment.
     *
     * @param environment Spring environment
     */
    public BridgeEnvironment(Environment environment) {
        this.environment = environment;
    }

    /**
     * Get the first non-blank value among the given keys.
     *
     * @param keys property keys, in lookup order
     * @return trimmed value, or null when every key is missing or blank
     */
    public String getTrimmed(String... keys) {
        if (environment == null || keys == null) {
            return null;
        }
        for (String key : keys) {
            if (key == null) {
                continue;
            }
            String v = environment.getProperty(key);
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    /**
     * Get a value with a default.
     *
     * @param defaultValue value used when every key is missing
     * @param keys property keys, in lookup order
     * @return resolved value
     */
    public String getOrDefault(String defaultValue, String... keys) {
        String v = getTrimmed(keys);
        return v != null ? v : defaultValue;
    }

    /**
     * Get an integer value.
     *
     * @param defaultValue value used when missing or unparseable
     * @param keys property keys, in lookup order
     * @return resolved value
     */
    public int getInt(int defaultValue, String... keys) {
        String v = getTrimmed(keys);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Get a boolean value. Accepts {@code true/1/yes/y/on} and {@code false/0/no/n/off}.
     *
     * @param defaultValue value used when missing or unrecognised
     * @param keys property keys, in lookup order
     * @return resolved value
     */
    public boolean getBool(boolean defaultValue, String... keys) {
        String v = getTrimmed(keys);
        if (v == null) {
            return defaultValue;
        }
        String s = v.toLowerCase(Locale.ROOT);
        if ("true".equals(s) || "1".equals(s) || "yes".equals(s) || "y".equals(s) || "on".equals(s)) {
            return true;
        }
        if ("false".equals(s) || "0".equals(s) || "no".equals(s) || "n".equals(s) || "off".equals(s)) {
            return false;
        }
        return defaultValue;
    }
}
