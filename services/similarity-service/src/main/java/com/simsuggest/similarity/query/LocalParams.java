package com.simsuggest.similarity.query;

import java.util.regex.Pattern;

public final class LocalParams {
    private static final Pattern LOCAL_PARAM_IDENTIFIER = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private LocalParams() {
    }

    /**
     * Values placed inside {@code {!...}} local params cannot be escaped, so they are restricted to plain identifiers.
     */
    public static String requireIdentifier(String name, String value) {
        if (value == null || !LOCAL_PARAM_IDENTIFIER.matcher(value).matches()) {
            throw new InvalidConfigurationException(name + " must be a plain identifier: " + value);
        }
        return value;
    }
}
