package com.simsuggest.similarity.document;

/**
 * Identifies a content item by its record type and uid, independent of how the search index stores it.
 */
public record DocumentRef(String type, int id) {
    public static final String PAGES = "pages";

    public DocumentRef {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("document type is required");
        }
        if (id <= 0) {
            throw new IllegalArgumentException("document id must be positive: " + id);
        }
        type = type.trim();
    }

    public static DocumentRef page(int id) {
        return new DocumentRef(PAGES, id);
    }

    public boolean isPage() {
        return PAGES.equals(type);
    }

    public String key() {
        return type + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
