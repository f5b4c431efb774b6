package com.lmbridge.controller;

import com.lmbridge.album.AlbumCache;
import com.lmbridge.api.CacheOperationResponse;
import com.lmbridge.api.ErrorResponse;
import com.lmbridge.api.HooksResponse;
import com.lmbridge.api.ProviderCapability;
import com.lmbridge.api.ReleaseFilterConfigRequest;
import com.lmbridge.api.ReleaseFilterConfigResponse;
import com.lmbridge.api.VersionResponse;
import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.filter.ReleaseFilterSettings;
import com.lmbridge.hooks.DbHookRegistry;
import com.lmbridge.intercept.QueryPipeline;
import com.lmbridge.mitm.PayloadTransformRegistry;
import com.lmbridge.provider.ProviderCapabilities;
import com.lmbridge.version.VersionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.function.IntSupplier;

@RestController
public class BridgeController {

    private static final Logger log = LoggerFactory.getLogger(BridgeController.class);

    private final ReleaseFilterSettings filterSettings;
    private final VersionService versionService;
    private final ProviderCapabilities providerCapabilities;
    private final DbHookRegistry hookRegistry;
    private final PayloadTransformRegistry transformRegistry;
    private final QueryPipeline queryPipeline;
    private final AlbumCache albumCache;
    private final BridgeEnvironment environment;

    public BridgeController(
            ReleaseFilterSettings filterSettings,
            VersionService versionService,
            ProviderCapabilities providerCapabilities,
            DbHookRegistry hookRegistry,
            PayloadTransformRegistry transformRegistry,
            QueryPipeline queryPipeline,
            AlbumCache albumCache,
            BridgeEnvironment environment
    ) {
        this.filterSettings = filterSettings;
        this.versionService = versionService;
        this.providerCapabilities = providerCapabilities;
        this.hookRegistry = hookRegistry;
        this.transformRegistry = transformRegistry;
        this.queryPipeline = queryPipeline;
        this.albumCache = albumCache;
        this.environment = environment;
    }

    /**
     * Replace the release filter configuration.
     *
     * POST /config/release-filter
     *
     * Absent fields are cleared; {@code enabled=false} clears every field.
     *
     * @param request new configuration, may be empty
     * @return applied configuration
     */
    @PostMapping("/config/release-filter")
    public ResponseEntity<ReleaseFilterConfigResponse> setReleaseFilter(
            @Valid @RequestBody(required = false) ReleaseFilterConfigRequest request) {
        ReleaseFilterConfigRequest body = request != null ? request : new ReleaseFilterConfigRequest();
        boolean enabled = body.isEnabledFlag();
        if (enabled) {
            filterSettings.setExcludeTokens(body.getExcludeMediaFormats());
            filterSettings.setIncludeTokens(body.getIncludeMediaFormats());
            filterSettings.setKeepOnlyCount(body.getKeepOnlyMediaCount());
            filterSettings.setPrefer(body.getPrefer());
        } else {
            filterSettings.disable();
        }
        // cached documents were filtered with the previous settings
        albumCache.clear();

        log.info("Release filter updated: enabled={}, exclude={}, include={}, keepOnly={}, prefer={}",
                enabled, filterSettings.getExcludeTokens(), filterSettings.getIncludeTokens(),
                filterSettings.getKeepOnlyCount(), filterSettings.getPrefer());
        return ResponseEntity.ok(currentConfig(enabled));
    }

    /**
     * Current release filter configuration.
     *
     * GET /config/release-filter
     */
    @GetMapping("/config/release-filter")
    public ResponseEntity<ReleaseFilterConfigResponse> getReleaseFilter() {
        return ResponseEntity.ok(currentConfig(filterSettings.isActive()));
    }

    @GetMapping("/version")
    public ResponseEntity<VersionResponse> version() {
        return ResponseEntity.ok(new VersionResponse(versionService.getVersion()));
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderCapability>> providers() {
        return ResponseEntity.ok(providerCapabilities.list());
    }

    @GetMapping("/hooks")
    public ResponseEntity<HooksResponse> hooks() {
        return ResponseEntity.ok(HooksResponse.builder()
                .dbHooks(hookRegistry.describe())
                .payloadTransforms(transformRegistry.describe())
                .interceptors(queryPipeline.getInterceptorNames())
                .build());
    }

    /**
     * Drop every album cache entry.
     *
     * POST /cache/clear
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return cacheOperation("clear", authorization, albumCache::clear);
    }

    /**
     * Mark every album cache entry as expired.
     *
     * POST /cache/expire
     */
    @PostMapping("/cache/expire")
    public ResponseEntity<?> expireCache(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return cacheOperation("expire", authorization, albumCache::expireAll);
    }

    private ResponseEntity<?> cacheOperation(String operation, String authorization, IntSupplier action) {
        String apiKey = environment.getTrimmed("lmbridge.api-key", "LMBRIDGE_APIKEY");
        if (apiKey != null && !apiKey.equals(authorization)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.builder()
                    .code("UNAUTHORIZED")
                    .message("Invalid or missing API key")
                    .traceId(MDC.get("trace_id"))
                    .build());
        }
        int entries = action.getAsInt();
        return ResponseEntity.ok(CacheOperationResponse.builder()
                .operation(operation)
                .caches(List.of("album"))
                .entries(entries)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    private ReleaseFilterConfigResponse currentConfig(boolean enabled) {
        List<String> exclude = filterSettings.getExcludeTokens();
        List<String> include = filterSettings.getIncludeTokens();
        return ReleaseFilterConfigResponse.builder()
                .ok(true)
                .enabled(enabled)
                .excludeMediaFormats(exclude != null ? exclude : List.of())
                .includeMediaFormats(include != null ? include : List.of())
                .keepOnlyMediaCount(filterSettings.getKeepOnlyCount())
                .prefer(filterSettings.getPrefer())
                .build();
    }
}
