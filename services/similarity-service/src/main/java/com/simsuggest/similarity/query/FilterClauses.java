package com.simsuggest.similarity.query;

import java.util.List;

public final class FilterClauses {
    private final List<String> allowedTypes;
    private final List<String> excludedTypes;
    private final List<Integer> containerIds;

    public FilterClauses(List<String> allowedTypes, List<String> excludedTypes, List<Integer> containerIds) {
        this.allowedTypes = allowedTypes == null ? List.of() : List.copyOf(allowedTypes);
        this.excludedTypes = excludedTypes == null ? List.of() : List.copyOf(excludedTypes);
        this.containerIds = containerIds == null ? List.of() : List.copyOf(containerIds);
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }

    public List<String> getExcludedTypes() {
        return excludedTypes;
    }

    public List<Integer> getContainerIds() {
        return containerIds;
    }
}
