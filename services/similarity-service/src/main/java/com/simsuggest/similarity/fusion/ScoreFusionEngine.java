package com.simsuggest.similarity.fusion;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.retrieval.RankedResultSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Merges lexical and vector candidates into one ranking.
 *
 * <p>Each side is normalized by its own maximum (left as is when that maximum is not positive), candidates are
 * keyed by document, and the fused score is {@code lexicalWeight * lexical + vectorWeight * vector} with a missing
 * side counting as zero. At equal fused score, documents found by both sides come first; remaining ties keep
 * lexical-first input order.
 */
@Component
public class ScoreFusionEngine {
    private static final Comparator<Fused> RANKING = Comparator
        .comparingDouble(Fused::fusedScore).reversed()
        .thenComparing(Fused::isDualOrigin, Comparator.reverseOrder());

    public RankedResultSet fuse(List<Candidate> lexical, List<Candidate> vector, FusionPolicy policy, int limit) {
        if (limit <= 0) {
            return RankedResultSet.empty();
        }
        Map<DocumentRef, Fused> merged = new LinkedHashMap<>();
        double lexicalMax = maxScore(lexical);
        for (Candidate candidate : lexical) {
            Fused entry = merged.computeIfAbsent(candidate.getDocumentRef(), ref -> new Fused(candidate));
            if (entry.lexical == null) {
                entry.lexical = normalize(candidate.getScore(), lexicalMax);
            }
        }
        double vectorMax = maxScore(vector);
        for (Candidate candidate : vector) {
            Fused entry = merged.computeIfAbsent(candidate.getDocumentRef(), ref -> new Fused(candidate));
            if (entry.vector == null) {
                entry.vector = normalize(candidate.getScore(), vectorMax);
            }
        }

        List<Fused> ranked = new ArrayList<>(merged.values());
        for (Fused entry : ranked) {
            entry.fused = policy.lexicalWeight() * entry.lexicalOrZero() + policy.vectorWeight() * entry.vectorOrZero();
        }
        ranked.sort(RANKING);

        List<Candidate> out = new ArrayList<>(Math.min(limit, ranked.size()));
        for (Fused entry : ranked) {
            if (out.size() >= limit) {
                break;
            }
            out.add(entry.base.withFusedScores(entry.fused, entry.lexicalOrZero(), entry.vectorOrZero(), entry.origin()));
        }
        return RankedResultSet.of(out);
    }

    static double normalize(double score, double max) {
        return max > 0 ? score / max : score;
    }

    private static double maxScore(List<Candidate> candidates) {
        double max = Double.NEGATIVE_INFINITY;
        for (Candidate candidate : candidates) {
            max = Math.max(max, candidate.getScore());
        }
        return max;
    }

    private static final class Fused {
        private final Candidate base;
        private Double lexical;
        private Double vector;
        private double fused;

        private Fused(Candidate base) {
            this.base = base;
        }

        double fusedScore() {
            return fused;
        }

        boolean isDualOrigin() {
            return lexical != null && vector != null;
        }

        double lexicalOrZero() {
            return lexical == null ? 0.0 : lexical;
        }

        double vectorOrZero() {
            return vector == null ? 0.0 : vector;
        }

        String origin() {
            if (isDualOrigin()) {
                return Candidate.ORIGIN_HYBRID;
            }
            return lexical != null ? Algorithm.LEXICAL.tag() : Algorithm.VECTOR.tag();
        }
    }
}
