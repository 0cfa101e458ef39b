package com.simsuggest.similarity.query;

import com.simsuggest.similarity.document.DocumentRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One backend call, fully rendered. Built once per retrieval attempt and never changed after dispatch.
 */
public final class QueryDescriptor {
    private final Algorithm algorithm;
    private final DocumentRef target;
    private final String sourceBackendId;
    private final String handler;
    private final int rows;
    private final Map<String, List<String>> params;

    private QueryDescriptor(Builder builder) {
        this.algorithm = builder.algorithm;
        this.target = builder.target;
        this.sourceBackendId = builder.sourceBackendId;
        this.handler = builder.handler;
        this.rows = builder.rows;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.params.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        this.params = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(Algorithm algorithm, DocumentRef target) {
        return new Builder(algorithm, target);
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public DocumentRef getTarget() {
        return target;
    }

    public String getSourceBackendId() {
        return sourceBackendId;
    }

    public String getHandler() {
        return handler;
    }

    public int getRows() {
        return rows;
    }

    public Map<String, List<String>> getParams() {
        return params;
    }

    public String firstParam(String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public static final class Builder {
        private final Algorithm algorithm;
        private final DocumentRef target;
        private final Map<String, List<String>> params = new LinkedHashMap<>();
        private String sourceBackendId;
        private String handler;
        private int rows;

        private Builder(Algorithm algorithm, DocumentRef target) {
            this.algorithm = algorithm;
            this.target = target;
        }

        public Builder sourceBackendId(String sourceBackendId) {
            this.sourceBackendId = sourceBackendId;
            return this;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder rows(int rows) {
            this.rows = rows;
            return param("rows", Integer.toString(rows));
        }

        public Builder param(String name, String value) {
            params.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
            return this;
        }

        public QueryDescriptor build() {
            return new QueryDescriptor(this);
        }
    }
}
