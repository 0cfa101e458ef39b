package com.simsuggest.similarity.query;

public enum Algorithm {
    LEXICAL("lexical"),
    VECTOR("vector"),
    HYBRID_NATIVE("hybrid-native");

    private final String tag;

    Algorithm(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
