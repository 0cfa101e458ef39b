package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.query.SimilaritySettings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Service-wide settings map, keyed like the request settings ({@code maxResults}, {@code mltFields}, ...).
 */
@Component
@ConfigurationProperties(prefix = "similarity")
public class SimilarityDefaultsProperties {
    private Map<String, String> defaults = new LinkedHashMap<>();

    public Map<String, String> getDefaults() {
        return defaults;
    }

    public void setDefaults(Map<String, String> defaults) {
        this.defaults = defaults == null ? new LinkedHashMap<>() : defaults;
    }

    /**
     * Defaults overlaid with non-blank request overrides.
     */
    public SimilaritySettings resolve(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(defaults);
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (key != null && value != null && !value.isBlank()) {
                    merged.put(key, value);
                }
            });
        }
        return SimilaritySettings.fromMap(merged);
    }
}
