package com.lmbridge.mitm;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmbridge.config.BridgeEnvironment;
import com.lmbridge.hooks.HookLoader;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the built-in and the custom {@link PayloadTransform} over a response body, in that order.
 * A failing transform is logged and skipped.
 */
@Slf4j
@Component
public class PayloadTransformRegistry {

    private static final String LABEL = "MITM";

    private final PayloadTransform builtinTransform;
    private final HookLoader hookLoader;
    private final BridgeEnvironment environment;

    private volatile PayloadTransform customTransform;
    private volatile boolean customLoadAttempted;

    @Autowired
    public PayloadTransformRegistry(ReleaseGroupPayloadTransform builtinTransform, HookLoader hookLoader, BridgeEnvironment environment) {
        this.builtinTransform = builtinTransform;
        this.hookLoader = hookLoader;
        this.environment = environment;
    }

    PayloadTransformRegistry(PayloadTransform builtinTransform, PayloadTransform customTransform) {
        this.builtinTransform = builtinTransform;
        this.hookLoader = null;
        this.environment = null;
        this.customTransform = customTransform;
        this.customLoadAttempted = true;
    }

    /**
     * Resolve the custom transform once.
     */
    @PostConstruct
    public synchronized void init() {
        if (customLoadAttempted) {
            return;
        }
        customLoadAttempted = true;

        String className = environment.getTrimmed(
                "lmbridge.mitm.class", "LMBRIDGE_MITM_AFTER_MODULE", "LMBRIDGE_MITM_MODULE");
        String path = environment.getTrimmed(
                "lmbridge.mitm.path", "LMBRIDGE_MITM_AFTER_PATH", "LMBRIDGE_MITM_PATH");

        if (builtinTransform != null && builtinTransform.getClass().getName().equals(className) && path == null) {
            log.warn("LM-Bridge MITM: {} is built-in and applied automatically.", className);
            return;
        }
        customTransform = hookLoader.load(PayloadTransform.class, className, path, LABEL).orElse(null);
    }

    /**
     * Whether any transform is active.
     *
     * @return true when at least one transform is registered
     */
    public boolean hasTransforms() {
        return builtinTransform != null || customTransform != null;
    }

    /**
     * Run every transform.
     *
     * @param payload parsed response body
     * @param context request attributes
     * @return final payload; the same instance when nothing changed it
     */
    public JsonNode apply(JsonNode payload, PayloadContext context) {
        JsonNode current = payload;
        for (PayloadTransform transform : new PayloadTransform[]{builtinTransform, customTransform}) {
            if (transform == null) {
                continue;
            }
            try {
                JsonNode updated = transform.transformPayload(current, context);
                if (updated != null) {
                    current = updated;
                }
            } catch (Exception e) {
                log.error("LM-Bridge MITM: transform_payload failed in {}", transform.getClass().getName(), e);
            }
        }
        return current;
    }

    public Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("builtin", builtinTransform != null ? builtinTransform.getClass().getName() : null);
        PayloadTransform custom = customTransform;
        m.put("custom", custom != null ? custom.getClass().getName() : null);
        return m;
    }
}
