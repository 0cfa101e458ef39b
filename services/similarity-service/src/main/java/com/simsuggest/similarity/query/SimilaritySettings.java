package com.simsuggest.similarity.query;

import com.simsuggest.similarity.fusion.FusionPolicy;
import com.simsuggest.similarity.mode.HybridStrategy;
import com.simsuggest.similarity.mode.SimilarityMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the flat string settings map handed in by the caller. Unknown keys are ignored, absent keys take
 * the defaults below and malformed values fail with {@link InvalidConfigurationException}.
 */
public final class SimilaritySettings {
    public static final String SIMILARITY_MODE = "similarityMode";
    public static final String HYBRID_STRATEGY = "hybridStrategy";
    public static final String MAX_RESULTS = "maxResults";
    public static final String MIN_TERM_FREQ = "minTermFreq";
    public static final String MIN_DOC_FREQ = "minDocFreq";
    public static final String MLT_FIELDS = "mltFields";
    public static final String BOOST_FIELDS = "boostFields";
    public static final String VECTOR_TOP_K = "vectorTopK";
    public static final String VECTOR_MODEL_NAME = "vectorModelName";
    public static final String VECTOR_FIELD = "vectorField";
    public static final String MLT_WEIGHT = "mltWeight";
    public static final String VECTOR_WEIGHT = "vectorWeight";
    public static final String LEGACY_MLT_WEIGHT = "smltMltWeight";
    public static final String LEGACY_VECTOR_WEIGHT = "smltVectorWeight";
    public static final String MIN_SCORE = "minScore";
    public static final String MIN_SCORE_RATIO = "minScoreRatio";
    public static final String ALLOWED_TYPES = "allowedTypes";
    public static final String EXCLUDED_TYPES = "excludeContentTypes";
    public static final String FILTER_BY_PIDS = "filterByPids";
    public static final String HYBRID_OVERFETCH_FACTOR = "hybridOverfetchFactor";

    private static final int DEFAULT_MAX_RESULTS = 6;
    private static final int DEFAULT_VECTOR_TOP_K = 50;
    private static final int DEFAULT_OVERFETCH_FACTOR = 2;
    private static final String DEFAULT_MLT_FIELDS = "content,title,keywords";
    private static final String DEFAULT_BOOST_FIELDS = "content^0.5,title^1.2,keywords^2.0";
    private static final double DEFAULT_MLT_WEIGHT = 0.4;
    private static final double DEFAULT_VECTOR_WEIGHT = 0.6;

    private final SimilarityMode mode;
    private final HybridStrategy hybridStrategy;
    private final int maxResults;
    private final int minTermFreq;
    private final int minDocFreq;
    private final List<String> mltFields;
    private final Map<String, Double> boostFields;
    private final int vectorTopK;
    private final String vectorModelName;
    private final String vectorField;
    private final FusionPolicy fusionPolicy;
    private final double minScore;
    private final double minScoreRatio;
    private final FilterClauses filters;
    private final int overfetchFactor;

    private SimilaritySettings(Map<String, String> values) {
        this.mode = SimilarityMode.fromToken(values.get(SIMILARITY_MODE));
        this.hybridStrategy = HybridStrategy.fromToken(values.get(HYBRID_STRATEGY));
        this.maxResults = parseInt(values, MAX_RESULTS, DEFAULT_MAX_RESULTS, 1);
        this.minTermFreq = parseInt(values, MIN_TERM_FREQ, 1, 0);
        this.minDocFreq = parseInt(values, MIN_DOC_FREQ, 1, 0);
        this.mltFields = parseList(valueOrDefault(values, MLT_FIELDS, DEFAULT_MLT_FIELDS));
        this.boostFields = parseWeightedFields(valueOrDefault(values, BOOST_FIELDS, DEFAULT_BOOST_FIELDS));
        this.vectorTopK = parseInt(values, VECTOR_TOP_K, DEFAULT_VECTOR_TOP_K, 1);
        this.vectorModelName = valueOrDefault(values, VECTOR_MODEL_NAME, "llm");
        this.vectorField = valueOrDefault(values, VECTOR_FIELD, "vector");
        double lexicalWeight = parseDouble(values, MLT_WEIGHT, parseDouble(values, LEGACY_MLT_WEIGHT, DEFAULT_MLT_WEIGHT));
        double vectorWeight = parseDouble(
            values,
            VECTOR_WEIGHT,
            parseDouble(values, LEGACY_VECTOR_WEIGHT, DEFAULT_VECTOR_WEIGHT)
        );
        if (lexicalWeight < 0 || vectorWeight < 0) {
            throw new InvalidConfigurationException("fusion weights must not be negative");
        }
        this.fusionPolicy = new FusionPolicy(lexicalWeight, vectorWeight);
        this.minScore = parseDouble(values, MIN_SCORE, 0.0);
        this.minScoreRatio = parseDouble(values, MIN_SCORE_RATIO, 0.0);
        this.filters = new FilterClauses(
            parseList(values.get(ALLOWED_TYPES)),
            parseList(values.get(EXCLUDED_TYPES)),
            parseIntList(values, FILTER_BY_PIDS)
        );
        this.overfetchFactor = parseInt(values, HYBRID_OVERFETCH_FACTOR, DEFAULT_OVERFETCH_FACTOR, 1);
    }

    public static SimilaritySettings fromMap(Map<String, String> values) {
        return new SimilaritySettings(values == null ? Map.of() : values);
    }

    public static SimilaritySettings defaults() {
        return fromMap(Map.of());
    }

    public SimilarityMode getMode() {
        return mode;
    }

    public HybridStrategy getHybridStrategy() {
        return hybridStrategy;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public int getMinTermFreq() {
        return minTermFreq;
    }

    public int getMinDocFreq() {
        return minDocFreq;
    }

    public List<String> getMltFields() {
        return mltFields;
    }

    public Map<String, Double> getBoostFields() {
        return boostFields;
    }

    public int getVectorTopK() {
        return vectorTopK;
    }

    public String getVectorModelName() {
        return vectorModelName;
    }

    public String getVectorField() {
        return vectorField;
    }

    public FusionPolicy getFusionPolicy() {
        return fusionPolicy;
    }

    public double getMinScore() {
        return minScore;
    }

    public double getMinScoreRatio() {
        return minScoreRatio;
    }

    public FilterClauses getFilters() {
        return filters;
    }

    public int getOverfetchFactor() {
        return overfetchFactor;
    }

    private static String valueOrDefault(Map<String, String> values, String key, String defaultValue) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static int parseInt(Map<String, String> values, String key, int defaultValue, int min) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be an integer: " + value, e);
        }
        if (parsed < min) {
            throw new InvalidConfigurationException(key + " must be >= " + min + ": " + value);
        }
        return parsed;
    }

    private static double parseDouble(Map<String, String> values, String key, double defaultValue) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new InvalidConfigurationException(key + " must be a finite number: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be a number: " + value, e);
        }
    }

    static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return Collections.unmodifiableList(items);
    }

    private static List<Integer> parseIntList(Map<String, String> values, String key) {
        List<Integer> ids = new ArrayList<>();
        for (String item : parseList(values.get(key))) {
            try {
                ids.add(Integer.parseInt(item));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(key + " must list integer ids: " + item, e);
            }
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * Parses {@code field^weight} entries separated by commas or whitespace. A field without a weight gets 1.0.
     */
    static Map<String, Double> parseWeightedFields(String value) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return weights;
        }
        for (String part : value.split("[,\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            int caret = part.indexOf('^');
            if (caret < 0) {
                weights.put(part, 1.0);
                continue;
            }
            String field = part.substring(0, caret);
            if (field.isEmpty()) {
                throw new InvalidConfigurationException("boost field without a name: " + part);
            }
            try {
                weights.put(field, Double.parseDouble(part.substring(caret + 1)));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("invalid boost weight: " + part, e);
            }
        }
        return Collections.unmodifiableMap(weights);
    }
}
