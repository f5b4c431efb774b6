package com.lmbridge.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HooksResponse {
    private Map<String, Object> dbHooks;
    private Map<String, Object> payloadTransforms;
    private List<String> interceptors;
}
