package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.document.DocumentRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidates in rank order, highest first, at most one per document. Building one keeps the first occurrence of
 * each document and never reorders.
 */
public final class RankedResultSet {
    private static final RankedResultSet EMPTY = new RankedResultSet(List.of());

    private final List<Candidate> candidates;

    private RankedResultSet(List<Candidate> candidates) {
        this.candidates = candidates;
    }

    public static RankedResultSet of(List<Candidate> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            return EMPTY;
        }
        Set<DocumentRef> seen = new HashSet<>();
        List<Candidate> unique = new ArrayList<>(ranked.size());
        for (Candidate candidate : ranked) {
            if (seen.add(candidate.getDocumentRef())) {
                unique.add(candidate);
            }
        }
        return new RankedResultSet(Collections.unmodifiableList(unique));
    }

    public static RankedResultSet empty() {
        return EMPTY;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public double topScore() {
        return candidates.isEmpty() ? 0.0 : candidates.get(0).getScore();
    }
}
