package com.simsuggest.similarity.retrieval;

public enum RetrievalError {
    BACKEND_UNAVAILABLE("backend_unavailable"),
    BACKEND_QUERY_ERROR("backend_query_error"),
    ROUTING_FAILED("routing_failed"),
    UNPARSABLE_RESPONSE("unparsable_response"),
    TIMEOUT("timeout");

    private final String code;

    RetrievalError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
