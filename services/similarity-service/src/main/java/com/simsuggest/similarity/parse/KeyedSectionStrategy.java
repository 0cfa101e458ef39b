package com.simsuggest.similarity.parse;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * {@code {"<id>": {"docs": [...]}}}: results keyed by the source document's backend id. When the source id is
 * unknown or absent the first keyed entry carrying docs is used.
 */
public class KeyedSectionStrategy implements SectionStrategy {
    @Override
    public Optional<JsonNode> locateDocs(JsonNode section, String sourceBackendId) {
        if (section == null || !section.isObject() || SectionStrategy.hasDocs(section)) {
            return Optional.empty();
        }
        if (sourceBackendId != null && SectionStrategy.hasDocs(section.get(sourceBackendId))) {
            return Optional.of(section.get(sourceBackendId).get("docs"));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (SectionStrategy.hasDocs(value)) {
                return Optional.of(value.get("docs"));
            }
        }
        return Optional.empty();
    }
}
