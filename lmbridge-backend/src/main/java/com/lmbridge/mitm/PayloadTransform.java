package com.lmbridge.mitm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rewrites JSON response bodies before they are returned to the caller.
 *
 * <p>Operator-supplied implementations need a public no-arg constructor.
 */
public interface PayloadTransform {

    /**
     * Transform a response payload.
     *
     * @param payload parsed response body; implementations may mutate it or return a new node
     * @param context request attributes
     * @return replacement payload, or null to leave the payload unchanged
     */
    JsonNode transformPayload(JsonNode payload, PayloadContext context);
}
