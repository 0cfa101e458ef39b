package com.simsuggest.similarity.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RebuildRequest {
    @JsonProperty("root_id")
    private Integer rootId;
    private Integer language;
    private String mode;

    public Integer getRootId() {
        return rootId;
    }

    public void setRootId(Integer rootId) {
        this.rootId = rootId;
    }

    public Integer getLanguage() {
        return language;
    }

    public void setLanguage(Integer language) {
        this.language = language;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }
}
