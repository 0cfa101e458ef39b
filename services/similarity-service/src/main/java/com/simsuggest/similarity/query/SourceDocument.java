package com.simsuggest.similarity.query;

import com.simsuggest.similarity.document.DocumentRef;

/**
 * What is known about the source document when a descriptor is built: its backend id for term-vector queries and
 * its text for text-to-vector queries. Either may be null when the path does not need it.
 */
public final class SourceDocument {
    private final DocumentRef ref;
    private final String backendId;
    private final String text;

    public SourceDocument(DocumentRef ref, String backendId, String text) {
        this.ref = ref;
        this.backendId = backendId;
        this.text = text;
    }

    public static SourceDocument withBackendId(DocumentRef ref, String backendId) {
        return new SourceDocument(ref, backendId, null);
    }

    public static SourceDocument withText(DocumentRef ref, String text) {
        return new SourceDocument(ref, null, text);
    }

    public DocumentRef getRef() {
        return ref;
    }

    public String getBackendId() {
        return backendId;
    }

    public String getText() {
        return text;
    }
}
