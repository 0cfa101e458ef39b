package com.simsuggest.similarity.solr;

import com.fasterxml.jackson.databind.JsonNode;
import com.simsuggest.similarity.query.Algorithm;

/**
 * Undecoded response body tagged with the algorithm that produced it. Consumed by the parser right away.
 */
public final class RawBackendResponse {
    private final Algorithm algorithm;
    private final JsonNode body;

    public RawBackendResponse(Algorithm algorithm, JsonNode body) {
        this.algorithm = algorithm;
        this.body = body;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public JsonNode getBody() {
        return body;
    }
}
