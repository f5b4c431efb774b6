package com.lmbridge.mitm;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Request attributes visible to a {@link PayloadTransform}.
 */
@Value
@Builder
public class PayloadContext {
    String path;
    String method;
    Map<String, List<String>> queryParams;
    Map<String, String> headers;
}
