package com.simsuggest.similarity.mode;

import org.springframework.stereotype.Component;

@Component
public class ModeSelector {

    /**
     * Resolves the configured mode to exactly one algorithm path. {@code auto} follows the vector capability
     * signal; explicit modes ignore it.
     */
    public AlgorithmPath select(SimilarityMode mode, boolean vectorEnabled) {
        if (mode == null) {
            mode = SimilarityMode.AUTO;
        }
        return switch (mode) {
            case LEXICAL -> AlgorithmPath.LEXICAL;
            case VECTOR -> AlgorithmPath.VECTOR;
            case HYBRID -> AlgorithmPath.HYBRID;
            case AUTO -> vectorEnabled ? AlgorithmPath.HYBRID : AlgorithmPath.LEXICAL;
        };
    }
}
