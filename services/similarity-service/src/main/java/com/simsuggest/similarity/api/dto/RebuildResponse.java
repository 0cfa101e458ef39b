package com.simsuggest.similarity.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RebuildResponse {
    private int updated;
    private int errors;
    @JsonProperty("took_ms")
    private long tookMs;

    public RebuildResponse() {
    }

    public RebuildResponse(int updated, int errors, long tookMs) {
        this.updated = updated;
        this.errors = errors;
        this.tookMs = tookMs;
    }

    public int getUpdated() {
        return updated;
    }

    public void setUpdated(int updated) {
        this.updated = updated;
    }

    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }
}
