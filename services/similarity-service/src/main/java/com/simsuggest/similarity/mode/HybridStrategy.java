package com.simsuggest.similarity.mode;

import com.simsuggest.similarity.query.InvalidConfigurationException;
import java.util.Locale;

/**
 * How the hybrid path reaches the backend: two requests fused here, or one request to a handler that fuses itself.
 */
public enum HybridStrategy {
    DUAL,
    NATIVE;

    public static HybridStrategy fromToken(String value) {
        if (value == null || value.isBlank()) {
            return DUAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("dual".equals(normalized)) {
            return DUAL;
        }
        if ("native".equals(normalized)) {
            return NATIVE;
        }
        throw new InvalidConfigurationException("unknown hybridStrategy: " + value);
    }
}
