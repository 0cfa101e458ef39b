package com.simsuggest.similarity.policy;

import com.simsuggest.similarity.query.FilterClauses;
import com.simsuggest.similarity.query.SimilaritySettings;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.retrieval.RankedResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Post-retrieval filters, applied in order: type allow-list (the deny-list is skipped when an allow-list is set),
 * type deny-list, container allow-list, absolute minimum score, minimum ratio of the top score, result limit.
 * Input is already ranked and is never reordered. The ratio threshold uses the top score before any filtering.
 */
@Component
public class ResultPolicyFilter {

    public RankedResultSet apply(RankedResultSet input, SimilaritySettings settings) {
        if (input.isEmpty()) {
            return input;
        }
        double ratioThreshold = settings.getMinScoreRatio() > 0 ? input.topScore() * settings.getMinScoreRatio() : 0;
        FilterClauses filters = settings.getFilters();
        List<Candidate> candidates = input.getCandidates();

        if (!filters.getAllowedTypes().isEmpty()) {
            candidates = keep(candidates, c -> filters.getAllowedTypes().contains(c.getType()));
        } else if (!filters.getExcludedTypes().isEmpty()) {
            candidates = keep(candidates, c -> !filters.getExcludedTypes().contains(c.getType()));
        }
        if (!filters.getContainerIds().isEmpty()) {
            // 0 means the index did not report a container
            candidates = keep(candidates, c -> c.getContainerId() == 0 || filters.getContainerIds().contains(c.getContainerId()));
        }
        if (settings.getMinScore() > 0) {
            double minScore = settings.getMinScore();
            candidates = keep(candidates, c -> c.getScore() >= minScore);
        }
        if (settings.getMinScoreRatio() > 0) {
            candidates = keep(candidates, c -> c.getScore() >= ratioThreshold);
        }
        if (candidates.size() > settings.getMaxResults()) {
            candidates = candidates.subList(0, settings.getMaxResults());
        }
        return RankedResultSet.of(candidates);
    }

    private static List<Candidate> keep(List<Candidate> candidates, Predicate<Candidate> predicate) {
        List<Candidate> kept = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (predicate.test(candidate)) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
