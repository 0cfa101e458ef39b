package com.simsuggest.similarity.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "similarity.resilience")
public class SimilarityResilienceProperties {
    private int vectorFailureThreshold = 3;
    private long vectorOpenMs = 30000;

    public int getVectorFailureThreshold() {
        return vectorFailureThreshold;
    }

    public void setVectorFailureThreshold(int vectorFailureThreshold) {
        this.vectorFailureThreshold = vectorFailureThreshold;
    }

    public long getVectorOpenMs() {
        return vectorOpenMs;
    }

    public void setVectorOpenMs(long vectorOpenMs) {
        this.vectorOpenMs = vectorOpenMs;
    }
}
