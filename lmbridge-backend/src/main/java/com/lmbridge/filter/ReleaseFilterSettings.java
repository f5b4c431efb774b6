package com.lmbridge.filter;

import com.lmbridge.config.BridgeEnvironment;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Process-wide release filter configuration.
 *
 * <p>Each field is replaced atomically; a filter pass may observe a mix of old and new fields
 * when a configuration call races with it. Token lists are alias-expanded when set.
 */
@Slf4j
@Component
public class ReleaseFilterSettings {

    public static final String PREFER_DIGITAL = "digital";
    public static final String PREFER_ANALOG = "analog";

    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

    private final BridgeEnvironment environment;

    private volatile List<String> excludeTokens;
    private volatile List<String> includeTokens;
    private volatile Integer keepOnlyCount;
    private volatile String prefer;

    /**
     * Create settings.
     *
     * @param environment bridge environment, may be null for an unconfigured instance
     */
    public ReleaseFilterSettings(BridgeEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Apply start-up defaults from the environment.
     */
    @PostConstruct
    public void loadDefaults() {
        if (environment == null) {
            return;
        }
        String exclude = environment.getTrimmed("lmbridge.release-filter.exclude", "LMBRIDGE_MEDIA_EXCLUDE");
        String include = environment.getTrimmed("lmbridge.release-filter.include", "LMBRIDGE_MEDIA_INCLUDE");
        String keepOnly = environment.getTrimmed("lmbridge.release-filter.keep-only", "LMBRIDGE_MEDIA_KEEP_ONLY");
        String preferValue = environment.getTrimmed("lmbridge.release-filter.prefer", "LMBRIDGE_MEDIA_PREFER");

        if (exclude != null) {
            setExcludeTokens(exclude);
        }
        if (include != null) {
            setIncludeTokens(include);
        }
        if (keepOnly != null) {
            setKeepOnlyCount(keepOnly);
        }
        if (preferValue != null) {
            setPrefer(preferValue);
        }
        if (isActive()) {
            log.info("Release filter defaults: exclude={}, include={}, keepOnly={}, prefer={}",
                    excludeTokens, includeTokens, keepOnlyCount, prefer);
        }
    }

    /**
     * Set exclude tokens.
     *
     * @param raw comma-separated string or collection of tokens; null clears
     */
    public void setExcludeTokens(Object raw) {
        List<String> tokens = MediaFormats.parseTokens(raw);
        excludeTokens = tokens != null ? MediaFormats.expandAliases(tokens) : null;
    }

    public List<String> getExcludeTokens() {
        return excludeTokens;
    }

    /**
     * Set include tokens.
     *
     * @param raw comma-separated string or collection of tokens; null clears
     */
    public void setIncludeTokens(Object raw) {
        List<String> tokens = MediaFormats.parseTokens(raw);
        includeTokens = tokens != null ? MediaFormats.expandAliases(tokens) : null;
    }

    public List<String> getIncludeTokens() {
        return includeTokens;
    }

    /**
     * Set the keep-only count. Non-positive or unparseable values clear it.
     *
     * @param raw integer, numeric string or boolean
     */
    public void setKeepOnlyCount(Object raw) {
        Integer count = parseInt(raw);
        keepOnlyCount = count != null && count > 0 ? count : null;
    }

    public Integer getKeepOnlyCount() {
        return keepOnlyCount;
    }

    /**
     * Set the keep-only preference. Anything but {@code digital} or {@code analog} clears it.
     *
     * @param raw preference
     */
    public void setPrefer(Object raw) {
        if (raw instanceof String s) {
            String token = s.trim().toLowerCase(Locale.ROOT);
            if (PREFER_DIGITAL.equals(token) || PREFER_ANALOG.equals(token)) {
                prefer = token;
                return;
            }
        }
        prefer = null;
    }

    public String getPrefer() {
        return prefer;
    }

    /**
     * Turn filtering off: both token lists become empty and the count and preference are cleared.
     */
    public void disable() {
        excludeTokens = List.of();
        includeTokens = List.of();
        keepOnlyCount = null;
        prefer = null;
    }

    /**
     * Whether any field is set.
     *
     * @return true if at least one field is configured
     */
    public boolean isActive() {
        List<String> exclude = excludeTokens;
        List<String> include = includeTokens;
        return (exclude != null && !exclude.isEmpty())
                || (include != null && !include.isEmpty())
                || keepOnlyCount != null
                || prefer != null;
    }

    /**
     * Priority tokens for keep-only ranking, chosen by the preference (digital first by default).
     *
     * @return ordered tokens
     */
    public List<String> getPriorityTokens() {
        return PREFER_ANALOG.equals(prefer) ? MediaFormats.PRIORITY_ANALOG_FIRST : MediaFormats.PRIORITY_DIGITAL_FIRST;
    }

    static Integer parseInt(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return saturate(BigInteger.valueOf(((Number) raw).longValue()));
        }
        if (raw instanceof BigInteger big) {
            return saturate(big);
        }
        if (raw instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return saturate(new BigInteger(trimmed));
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static int saturate(BigInteger value) {
        if (value.compareTo(INT_MAX) > 0) {
            return Integer.MAX_VALUE;
        }
        if (value.compareTo(INT_MIN) < 0) {
            return Integer.MIN_VALUE;
        }
        return value.intValue();
    }
}
