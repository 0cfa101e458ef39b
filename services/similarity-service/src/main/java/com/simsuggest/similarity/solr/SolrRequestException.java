package com.simsuggest.similarity.solr;

public class SolrRequestException extends RuntimeException {
    public SolrRequestException(String message) {
        super(message);
    }

    public SolrRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
