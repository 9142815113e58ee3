package com.vgen.generation.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of one generation call: candidate lines (not yet validated), the request body as sent and
 * the backend's raw response.
 */
public final class GenerationResult {

    private final List<String> variants;
    private final JsonNode requestSent;
    private final JsonNode rawResponse;
    private final boolean mock;

    public GenerationResult(List<String> variants, JsonNode requestSent, JsonNode rawResponse, boolean mock) {
        this.variants = variants != null ? List.copyOf(variants) : List.of();
        this.requestSent = requestSent;
        this.rawResponse = rawResponse;
        this.mock = mock;
    }

    public List<String> getVariants() {
        return variants;
    }

    /** Null in mock mode. */
    public JsonNode getRequestSent() {
        return requestSent;
    }

    public JsonNode getRawResponse() {
        return rawResponse;
    }

    public boolean isMock() {
        return mock;
    }
}
