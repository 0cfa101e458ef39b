package com.simsuggest.similarity.site;

public class RoutingFailedException extends RuntimeException {
    public RoutingFailedException(String message) {
        super(message);
    }

    public RoutingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
