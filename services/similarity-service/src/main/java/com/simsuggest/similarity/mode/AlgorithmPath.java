package com.simsuggest.similarity.mode;

public enum AlgorithmPath {
    LEXICAL,
    VECTOR,
    HYBRID;

    public String tag() {
        return name().toLowerCase();
    }
}
