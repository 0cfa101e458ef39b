package com.simsuggest.similarity.mode;

import com.simsuggest.similarity.query.InvalidConfigurationException;
import java.util.Locale;

public enum SimilarityMode {
    AUTO,
    LEXICAL,
    VECTOR,
    HYBRID;

    /**
     * Parses a configured mode token. Blank means {@link #AUTO}; the legacy tokens {@code mlt}, {@code knn} and
     * {@code smlt} are accepted for lexical, vector and hybrid.
     */
    public static SimilarityMode fromToken(String value) {
        if (value == null) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "auto" -> AUTO;
            case "lexical", "mlt" -> LEXICAL;
            case "vector", "knn" -> VECTOR;
            case "hybrid", "smlt" -> HYBRID;
            default -> throw new InvalidConfigurationException("unknown similarityMode: " + value);
        };
    }
}
