package com.simsuggest.similarity.retrieval;

import java.util.List;

/**
 * Outcome of one sub-query. Failures are values here, never exceptions, and the orchestrator decides how to fold
 * them. A not-indexed source document is a normal empty outcome, not an error.
 */
public class RetrievalStageResult {
    private final List<Candidate> candidates;
    private final RetrievalError error;
    private final boolean notIndexed;
    private final boolean skipped;
    private final long tookMs;
    private final String message;

    private RetrievalStageResult(
        List<Candidate> candidates,
        RetrievalError error,
        boolean notIndexed,
        boolean skipped,
        long tookMs,
        String message
    ) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.error = error;
        this.notIndexed = notIndexed;
        this.skipped = skipped;
        this.tookMs = tookMs;
        this.message = message;
    }

    public static RetrievalStageResult success(List<Candidate> candidates, long tookMs) {
        return new RetrievalStageResult(candidates, null, false, false, tookMs, null);
    }

    public static RetrievalStageResult notIndexed() {
        return new RetrievalStageResult(List.of(), null, true, false, 0L, "not_indexed");
    }

    public static RetrievalStageResult error(RetrievalError error, String message) {
        return new RetrievalStageResult(List.of(), error, false, false, 0L, message);
    }

    public static RetrievalStageResult timedOut() {
        return new RetrievalStageResult(List.of(), RetrievalError.TIMEOUT, false, false, 0L, "timeout");
    }

    public static RetrievalStageResult skipped(String reason) {
        return new RetrievalStageResult(List.of(), null, false, true, 0L, reason);
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public RetrievalError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isNotIndexed() {
        return notIndexed;
    }

    public boolean isSkipped() {
        return skipped;
    }

    /** True when the sub-query produced no usable answer for reasons other than the document not being indexed. */
    public boolean isFailed() {
        return error != null || skipped;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getMessage() {
        return message;
    }

    public String outcome() {
        if (error != null) {
            return error.code();
        }
        if (skipped) {
            return "skipped";
        }
        if (notIndexed) {
            return "not_indexed";
        }
        return candidates.isEmpty() ? "empty" : "hit";
    }
}
