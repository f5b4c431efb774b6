package com.lmbridge.mitm;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmbridge.filter.ReleaseFilterEngine;
import org.springframework.stereotype.Component;

/**
 * Applies the release filter to release-group documents served under {@code /album/}.
 */
@Component
public class ReleaseGroupPayloadTransform implements PayloadTransform {

    static final String ALBUM_PATH = "/album/";

    private final ReleaseFilterEngine filterEngine;

    public ReleaseGroupPayloadTransform(ReleaseFilterEngine filterEngine) {
        this.filterEngine = filterEngine;
    }

    @Override
    public JsonNode transformPayload(JsonNode payload, PayloadContext context) {
        if (payload == null || !payload.isObject() || context == null || context.getPath() == null
                || !context.getPath().startsWith(ALBUM_PATH)) {
            return null;
        }
        JsonNode copy = payload.deepCopy();
        if (!filterEngine.applyReleaseGroupFilters(copy) || copy.equals(payload)) {
            return null;
        }
        return copy;
    }
}
