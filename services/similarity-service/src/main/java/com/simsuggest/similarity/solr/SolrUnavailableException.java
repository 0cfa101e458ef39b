package com.simsuggest.similarity.solr;

public class SolrUnavailableException extends RuntimeException {
    public SolrUnavailableException(String message) {
        super(message);
    }

    public SolrUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
