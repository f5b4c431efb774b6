package com.lmbridge.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Body of {@code POST /config/release-filter}.
 *
 * Token lists accept a JSON array or a comma-separated string. Absent fields clear the
 * corresponding setting.
 */
@Data
@NoArgsConstructor
public class ReleaseFilterConfigRequest {

    private Object enabled = Boolean.TRUE;

    @JsonProperty("exclude_media_formats")
    @JsonAlias({"excludeMediaFormats", "media_exclude"})
    private Object excludeMediaFormats;

    @JsonProperty("include_media_formats")
    @JsonAlias({"includeMediaFormats", "media_include"})
    private Object includeMediaFormats;

    @JsonProperty("keep_only_media_count")
    @JsonAlias("keepOnlyMediaCount")
    private Object keepOnlyMediaCount;

    private Object prefer;

    /**
     * Interpret {@code enabled}: strings count when they read {@code 1/true/yes/on}, numbers when
     * non-zero, null as false.
     *
     * @return whether the filter stays enabled
     */
    @JsonIgnore
    public boolean isEnabledFlag() {
        Object v = enabled;
        if (v instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            return t.equals("1") || t.equals("true") || t.equals("yes") || t.equals("on");
        }
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return v != null;
    }
}
