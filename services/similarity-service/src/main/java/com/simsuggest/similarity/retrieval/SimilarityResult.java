package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.mode.AlgorithmPath;

/**
 * Ranked suggestions plus how they were obtained. {@code degraded} is set when at least one sub-query failed,
 * timed out or was skipped, so the set may be smaller than a healthy backend would have produced.
 */
public class SimilarityResult {
    private final AlgorithmPath path;
    private final RankedResultSet results;
    private final int rootContainerId;
    private final boolean degraded;

    public SimilarityResult(AlgorithmPath path, RankedResultSet results, int rootContainerId, boolean degraded) {
        this.path = path;
        this.results = results == null ? RankedResultSet.empty() : results;
        this.rootContainerId = rootContainerId;
        this.degraded = degraded;
    }

    public AlgorithmPath getPath() {
        return path;
    }

    public RankedResultSet getResults() {
        return results;
    }

    /** Site root the document was routed to, 0 when routing failed. */
    public int getRootContainerId() {
        return rootContainerId;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
