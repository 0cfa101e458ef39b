package com.simsuggest.similarity.text;

public final class TypeLabels {
    private TypeLabels() {
    }

    /**
     * Readable fallback label for a record type, e.g. {@code tx_news_domain_model_news} becomes {@code News news}.
     * Localized labels are resolved by the presentation layer.
     */
    public static String of(String type) {
        if (type == null || type.isBlank()) {
            return "";
        }
        String label = type.replace("tx_", "").replace("_domain_model_", " ").trim();
        if (label.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
