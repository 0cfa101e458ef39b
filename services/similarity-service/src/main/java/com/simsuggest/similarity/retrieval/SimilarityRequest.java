package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.document.DocumentRef;
import java.util.Map;

public class SimilarityRequest {
    private final DocumentRef ref;
    private final int languageId;
    private final Map<String, String> overrides;

    public SimilarityRequest(DocumentRef ref, int languageId, Map<String, String> overrides) {
        if (ref == null) {
            throw new IllegalArgumentException("document reference is required");
        }
        if (languageId < 0) {
            throw new IllegalArgumentException("language id must not be negative: " + languageId);
        }
        this.ref = ref;
        this.languageId = languageId;
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public DocumentRef getRef() {
        return ref;
    }

    public int getLanguageId() {
        return languageId;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }
}
