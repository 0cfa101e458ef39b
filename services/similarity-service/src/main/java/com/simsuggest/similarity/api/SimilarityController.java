package com.simsuggest.similarity.api;

import com.simsuggest.similarity.api.dto.RebuildRequest;
import com.simsuggest.similarity.api.dto.RebuildResponse;
import com.simsuggest.similarity.api.dto.SimilarRequest;
import com.simsuggest.similarity.api.dto.SimilarResponse;
import com.simsuggest.similarity.api.dto.SuggestionHit;
import com.simsuggest.similarity.bulk.BulkSimilarityUpdater;
import com.simsuggest.similarity.bulk.BulkUpdateReport;
import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.retrieval.SimilarityRequest;
import com.simsuggest.similarity.retrieval.SimilarityResult;
import com.simsuggest.similarity.retrieval.SimilarityService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SimilarityController {
    private static final String LANGUAGE_PARAM = "language";

    private final SimilarityService similarityService;
    private final BulkSimilarityUpdater bulkUpdater;

    public SimilarityController(SimilarityService similarityService, BulkSimilarityUpdater bulkUpdater) {
        this.similarityService = similarityService;
        this.bulkUpdater = bulkUpdater;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /**
     * Query parameters other than {@code language} override the service's settings defaults.
     */
    @GetMapping("/similar/{type}/{id}")
    public ResponseEntity<SimilarResponse> similar(
        @PathVariable("type") String type,
        @PathVariable("id") int id,
        @RequestParam Map<String, String> params,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        Map<String, String> overrides = new LinkedHashMap<>(params);
        String language = overrides.remove(LANGUAGE_PARAM);
        int languageId = parseLanguage(language);
        return ResponseEntity.ok(find(new DocumentRef(type, id), languageId, overrides, traceIdHeader, requestIdHeader));
    }

    @PostMapping("/internal/similar")
    public ResponseEntity<SimilarResponse> similarInternal(
        @RequestBody SimilarRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        if (request.getId() == null) {
            throw new IllegalArgumentException("id is required");
        }
        String type = request.getType() == null || request.getType().isBlank() ? DocumentRef.PAGES : request.getType();
        int languageId = request.getLanguage() == null ? 0 : request.getLanguage();
        DocumentRef ref = new DocumentRef(type, request.getId());
        return ResponseEntity.ok(find(ref, languageId, request.getSettings(), traceIdHeader, requestIdHeader));
    }

    @PostMapping("/internal/similarities/rebuild")
    public ResponseEntity<RebuildResponse> rebuild(@RequestBody(required = false) RebuildRequest request) {
        long started = System.nanoTime();
        String mode = request == null ? null : request.getMode();
        BulkUpdateReport report;
        if (request != null && request.getRootId() != null) {
            int languageId = request.getLanguage() == null ? 0 : request.getLanguage();
            report = bulkUpdater.updateSite(request.getRootId(), languageId, mode);
        } else {
            report = bulkUpdater.updateAll(mode);
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        return ResponseEntity.ok(new RebuildResponse(report.updated(), report.errors(), tookMs));
    }

    private SimilarResponse find(
        DocumentRef ref,
        int languageId,
        Map<String, String> overrides,
        String traceIdHeader,
        String requestIdHeader
    ) {
        long started = System.nanoTime();
        SimilarityResult result = similarityService.findSimilar(new SimilarityRequest(ref, languageId, overrides));

        List<SuggestionHit> hits = new ArrayList<>();
        for (Candidate candidate : result.getResults().getCandidates()) {
            hits.add(toHit(candidate));
        }
        SimilarResponse response = new SimilarResponse();
        response.setTraceId(RequestIdUtil.resolveOrGenerate(traceIdHeader));
        response.setRequestId(RequestIdUtil.resolveOrGenerate(requestIdHeader));
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        response.setAlgorithm(result.getPath().tag());
        response.setDegraded(result.isDegraded());
        response.setSuggestions(hits);
        return response;
    }

    private SuggestionHit toHit(Candidate candidate) {
        SuggestionHit hit = new SuggestionHit();
        hit.setType(candidate.getType());
        hit.setUid(candidate.getId());
        hit.setTitle(candidate.getTitle());
        hit.setUrl(candidate.getUrl());
        hit.setTypeLabel(candidate.getTypeLabel());
        hit.setSnippet(candidate.getSnippet());
        hit.setScore(candidate.getScore());
        hit.setLexicalScore(candidate.getLexicalScore());
        hit.setVectorScore(candidate.getVectorScore());
        hit.setOrigin(candidate.getAlgorithmOrigin());
        return hit;
    }

    private int parseLanguage(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("language must be an integer: " + value, e);
        }
    }
}
