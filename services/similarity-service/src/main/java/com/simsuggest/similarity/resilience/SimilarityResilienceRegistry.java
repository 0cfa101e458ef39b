package com.simsuggest.similarity.resilience;

import org.springframework.stereotype.Component;

@Component
public class SimilarityResilienceRegistry {
    private final CircuitBreaker vectorBreaker;

    public SimilarityResilienceRegistry(SimilarityResilienceProperties properties) {
        this.vectorBreaker = new CircuitBreaker(properties.getVectorFailureThreshold(), properties.getVectorOpenMs());
    }

    public CircuitBreaker getVectorBreaker() {
        return vectorBreaker;
    }
}
