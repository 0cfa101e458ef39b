package com.simsuggest.similarity.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SimilarResponse {
    @JsonProperty("trace_id")
    private String traceId;
    @JsonProperty("request_id")
    private String requestId;
    @JsonProperty("took_ms")
    private long tookMs;
    private String algorithm;
    private boolean degraded;
    private List<SuggestionHit> suggestions;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public List<SuggestionHit> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<SuggestionHit> suggestions) {
        this.suggestions = suggestions;
    }
}
