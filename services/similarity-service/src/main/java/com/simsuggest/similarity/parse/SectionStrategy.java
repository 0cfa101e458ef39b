package com.simsuggest.similarity.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Recognizes one encoding of a result section and returns its {@code docs} array.
 */
public interface SectionStrategy {
    Optional<JsonNode> locateDocs(JsonNode section, String sourceBackendId);

    static boolean hasDocs(JsonNode node) {
        return node != null && node.isObject() && node.path("docs").isArray();
    }
}
