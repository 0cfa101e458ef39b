package com.simsuggest.similarity.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * {@code ["<id>", {"docs": [...]}, ...]}: named-list output rendered as alternating keys and values.
 */
public class FlatPairsSectionStrategy implements SectionStrategy {
    @Override
    public Optional<JsonNode> locateDocs(JsonNode section, String sourceBackendId) {
        if (section == null || !section.isArray()) {
            return Optional.empty();
        }
        JsonNode firstMatch = null;
        for (int i = 0; i + 1 < section.size(); i += 2) {
            JsonNode value = section.get(i + 1);
            if (!SectionStrategy.hasDocs(value)) {
                continue;
            }
            if (sourceBackendId != null && sourceBackendId.equals(section.get(i).asText(null))) {
                return Optional.of(value.get("docs"));
            }
            if (firstMatch == null) {
                firstMatch = value.get("docs");
            }
        }
        return Optional.ofNullable(firstMatch);
    }
}
