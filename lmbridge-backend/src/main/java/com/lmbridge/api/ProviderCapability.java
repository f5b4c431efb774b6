package com.lmbridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Static description of an upstream metadata provider.
 */
@Data
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProviderCapability {
    private String id;
    private String displayName;
    private List<String> capabilities;
    private Auth auth;
    private Endpoints endpoints;
    private RateLimit rateLimit;
    private boolean supportsCache;
    private String pricing;
    private String notes;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Auth {
        private String type;
        private List<String> fields;
        private List<String> optionalFields;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Endpoints {
        private String baseUrl;
        private String docsUrl;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RateLimit {
        private Integer requestsPerSecond;
        private Integer requestsPerMinute;
        private String notes;
    }
}
