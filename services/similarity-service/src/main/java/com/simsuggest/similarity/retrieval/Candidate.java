package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.document.DocumentRef;

/**
 * One similar document. Before fusion {@code score} is on the backend's native scale; after fusion it is the
 * weighted sum of the normalized subscores.
 */
public final class Candidate {
    public static final String ORIGIN_HYBRID = "hybrid";

    private final DocumentRef documentRef;
    private final String title;
    private final String url;
    private final String typeLabel;
    private final String snippet;
    private final int containerId;
    private final double score;
    private final Double lexicalScore;
    private final Double vectorScore;
    private final String algorithmOrigin;

    public Candidate(
        DocumentRef documentRef,
        String title,
        String url,
        String typeLabel,
        String snippet,
        int containerId,
        double score,
        Double lexicalScore,
        Double vectorScore,
        String algorithmOrigin
    ) {
        this.documentRef = documentRef;
        this.title = title == null ? "" : title;
        this.url = url == null ? "" : url;
        this.typeLabel = typeLabel == null ? "" : typeLabel;
        this.snippet = snippet == null ? "" : snippet;
        this.containerId = containerId;
        this.score = score;
        this.lexicalScore = lexicalScore;
        this.vectorScore = vectorScore;
        this.algorithmOrigin = algorithmOrigin;
    }

    public Candidate withFusedScores(double fused, double lexical, double vector, String origin) {
        return new Candidate(documentRef, title, url, typeLabel, snippet, containerId, fused,
            lexical, vector, origin);
    }

    public DocumentRef getDocumentRef() {
        return documentRef;
    }

    public String getType() {
        return documentRef.type();
    }

    public int getId() {
        return documentRef.id();
    }

    public String getTitle() {
        return title;
    }

    public String getUrl() {
        return url;
    }

    public String getTypeLabel() {
        return typeLabel;
    }

    public String getSnippet() {
        return snippet;
    }

    /** Page the record is stored on, 0 when the index does not say. */
    public int getContainerId() {
        return containerId;
    }

    public double getScore() {
        return score;
    }

    public Double getLexicalScore() {
        return lexicalScore;
    }

    public Double getVectorScore() {
        return vectorScore;
    }

    public String getAlgorithmOrigin() {
        return algorithmOrigin;
    }

    @Override
    public String toString() {
        return "Candidate{" + documentRef.key() + ", score=" + score + ", origin=" + algorithmOrigin + "}";
    }
}
