package com.lmbridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReleaseFilterConfigResponse {
    private boolean ok;
    private boolean enabled;
    private List<String> excludeMediaFormats;
    private List<String> includeMediaFormats;
    private Integer keepOnlyMediaCount;
    private String prefer;
}
