package com.simsuggest.similarity.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * {@code {"numFound": n, "docs": [...]}}: a plain result list.
 */
public class DirectDocsSectionStrategy implements SectionStrategy {
    @Override
    public Optional<JsonNode> locateDocs(JsonNode section, String sourceBackendId) {
        if (SectionStrategy.hasDocs(section)) {
            return Optional.of(section.get("docs"));
        }
        return Optional.empty();
    }
}
