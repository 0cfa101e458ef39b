package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.execution.SimilarityExecutionProperties;
import com.simsuggest.similarity.fusion.ScoreFusionEngine;
import com.simsuggest.similarity.mode.AlgorithmPath;
import com.simsuggest.similarity.mode.HybridStrategy;
import com.simsuggest.similarity.mode.ModeSelector;
import com.simsuggest.similarity.mode.VectorSearchProperties;
import com.simsuggest.similarity.policy.ResultPolicyFilter;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.query.InvalidConfigurationException;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.SimilaritySettings;
import com.simsuggest.similarity.resilience.CircuitBreaker;
import com.simsuggest.similarity.resilience.SimilarityResilienceRegistry;
import com.simsuggest.similarity.site.RoutingFailedException;
import com.simsuggest.similarity.solr.PartitionRouter;
import com.simsuggest.similarity.solr.SolrPartition;
import io.micrometer.core.instrument.Metrics;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for "documents similar to this one".
 *
 * <p>Only invalid configuration is raised to the caller. Routing, backend and parsing failures are folded into
 * an empty, degraded result: no suggestions is always a valid answer.
 */
@Service
public class SimilarityService {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityService.class);

    private final ModeSelector modeSelector;
    private final VectorSearchProperties vectorProperties;
    private final SimilarityDefaultsProperties defaultsProperties;
    private final PartitionRouter partitionRouter;
    private final QueryBuilder queryBuilder;
    private final LexicalRetriever lexicalRetriever;
    private final VectorRetriever vectorRetriever;
    private final NativeHybridRetriever nativeHybridRetriever;
    private final ScoreFusionEngine fusionEngine;
    private final ResultPolicyFilter policyFilter;
    private final SimilarityResilienceRegistry resilienceRegistry;
    private final SimilarityExecutionProperties executionProperties;
    private final ExecutorService similarityExecutor;

    public SimilarityService(
        ModeSelector modeSelector,
        VectorSearchProperties vectorProperties,
        SimilarityDefaultsProperties defaultsProperties,
        PartitionRouter partitionRouter,
        QueryBuilder queryBuilder,
        LexicalRetriever lexicalRetriever,
        VectorRetriever vectorRetriever,
        NativeHybridRetriever nativeHybridRetriever,
        ScoreFusionEngine fusionEngine,
        ResultPolicyFilter policyFilter,
        SimilarityResilienceRegistry resilienceRegistry,
        SimilarityExecutionProperties executionProperties,
        @Qualifier("similarityExecutor") ExecutorService similarityExecutor
    ) {
        this.modeSelector = modeSelector;
        this.vectorProperties = vectorProperties;
        this.defaultsProperties = defaultsProperties;
        this.partitionRouter = partitionRouter;
        this.queryBuilder = queryBuilder;
        this.lexicalRetriever = lexicalRetriever;
        this.vectorRetriever = vectorRetriever;
        this.nativeHybridRetriever = nativeHybridRetriever;
        this.fusionEngine = fusionEngine;
        this.policyFilter = policyFilter;
        this.resilienceRegistry = resilienceRegistry;
        this.executionProperties = executionProperties;
        this.similarityExecutor = similarityExecutor;
    }

    public SimilarityResult findSimilar(SimilarityRequest request) {
        SimilaritySettings settings = defaultsProperties.resolve(request.getOverrides());
        return findSimilar(request, settings);
    }

    public SimilarityResult findSimilar(SimilarityRequest request, SimilaritySettings settings) {
        AlgorithmPath path = modeSelector.select(settings.getMode(), vectorProperties.isEnabled());

        SolrPartition partition;
        try {
            partition = partitionRouter.route(request.getRef(), request.getLanguageId());
        } catch (RoutingFailedException e) {
            logger.warn(
                "similarity_routing_failed ref={} language={} reason={}",
                request.getRef(),
                request.getLanguageId(),
                e.getMessage()
            );
            Metrics.counter("similarity.retrieval.total", "algorithm", path.tag(), "outcome",
                RetrievalError.ROUTING_FAILED.code()).increment();
            return new SimilarityResult(path, RankedResultSet.empty(), 0, true);
        }

        HybridStrategy strategy = settings.getHybridStrategy();
        int rows = queryBuilder.rowsFor(path, strategy, settings);
        RetrievalStageContext context =
            new RetrievalStageContext(request.getRef(), partition, settings, rows, backendBudgetMs());

        if (path == AlgorithmPath.HYBRID && strategy == HybridStrategy.DUAL) {
            return hybrid(request, settings, context, partition);
        }

        Algorithm algorithm = queryBuilder.algorithmsFor(path, strategy).get(0);
        RetrievalStageResult result = algorithm == Algorithm.VECTOR
            ? runVector(context)
            : awaitStage(CompletableFuture.supplyAsync(() -> retrieverFor(algorithm).retrieve(context), similarityExecutor));
        record(algorithm, result);
        if (result.isFailed()) {
            logger.warn(
                "similarity_retrieval_failed ref={} algorithm={} outcome={} message={}",
                request.getRef(),
                algorithm.tag(),
                result.outcome(),
                result.getMessage()
            );
            return new SimilarityResult(path, RankedResultSet.empty(), partition.rootContainerId(), true);
        }
        RankedResultSet filtered = policyFilter.apply(RankedResultSet.of(result.getCandidates()), settings);
        return new SimilarityResult(path, filtered, partition.rootContainerId(), false);
    }

    private SimilarityResult hybrid(
        SimilarityRequest request,
        SimilaritySettings settings,
        RetrievalStageContext context,
        SolrPartition partition
    ) {
        CompletableFuture<RetrievalStageResult> lexicalFuture =
            CompletableFuture.supplyAsync(() -> lexicalRetriever.retrieve(context), similarityExecutor);
        CompletableFuture<RetrievalStageResult> vectorFuture = submitVector(context);

        RetrievalStageResult lexicalResult = awaitStage(lexicalFuture);
        RetrievalStageResult vectorResult = awaitStage(vectorFuture);
        recordVectorOutcome(vectorResult);
        record(Algorithm.LEXICAL, lexicalResult);
        record(Algorithm.VECTOR, vectorResult);

        if (lexicalResult.isFailed() && vectorResult.isFailed()) {
            logger.warn(
                "similarity_hybrid_failed ref={} lexical={} vector={}",
                request.getRef(),
                lexicalResult.outcome(),
                vectorResult.outcome()
            );
            return new SimilarityResult(AlgorithmPath.HYBRID, RankedResultSet.empty(), partition.rootContainerId(), true);
        }
        boolean degraded = lexicalResult.isFailed() || vectorResult.isFailed();
        if (degraded) {
            logger.info(
                "similarity_hybrid_degraded ref={} lexical={} vector={}",
                request.getRef(),
                lexicalResult.outcome(),
                vectorResult.outcome()
            );
        }

        RankedResultSet fused = fusionEngine.fuse(
            lexicalResult.getCandidates(),
            vectorResult.getCandidates(),
            settings.getFusionPolicy(),
            context.getRows()
        );
        RankedResultSet filtered = policyFilter.apply(fused, settings);
        return new SimilarityResult(AlgorithmPath.HYBRID, filtered, partition.rootContainerId(), degraded);
    }

    private Retriever retrieverFor(Algorithm algorithm) {
        return switch (algorithm) {
            case LEXICAL -> lexicalRetriever;
            case VECTOR -> vectorRetriever;
            case HYBRID_NATIVE -> nativeHybridRetriever;
        };
    }

    private RetrievalStageResult runVector(RetrievalStageContext context) {
        RetrievalStageResult result = awaitStage(submitVector(context));
        recordVectorOutcome(result);
        return result;
    }

    private CompletableFuture<RetrievalStageResult> submitVector(RetrievalStageContext context) {
        if (!resilienceRegistry.getVectorBreaker().allowRequest()) {
            return CompletableFuture.completedFuture(RetrievalStageResult.skipped("vector_circuit_open"));
        }
        return CompletableFuture.supplyAsync(() -> vectorRetriever.retrieve(context), similarityExecutor);
    }

    private void recordVectorOutcome(RetrievalStageResult result) {
        if (result.isSkipped()) {
            return;
        }
        CircuitBreaker vectorBreaker = resilienceRegistry.getVectorBreaker();
        if (result.isError()) {
            vectorBreaker.recordFailure();
        } else {
            vectorBreaker.recordSuccess();
        }
    }

    private RetrievalStageResult awaitStage(CompletableFuture<RetrievalStageResult> future) {
        int timeoutMs = executionProperties.getTimeoutMs();
        try {
            if (timeoutMs > 0) {
                return future.get(timeoutMs, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            return RetrievalStageResult.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidConfigurationException invalid) {
                throw invalid;
            }
            return RetrievalStageResult.error(
                RetrievalError.BACKEND_QUERY_ERROR,
                cause == null ? e.getMessage() : cause.getMessage()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalStageResult.error(RetrievalError.BACKEND_QUERY_ERROR, "interrupted");
        }
    }

    /**
     * Stage timeout reused as the read budget of every backend call; null keeps the client's configured timeouts.
     */
    private Integer backendBudgetMs() {
        int timeoutMs = executionProperties.getTimeoutMs();
        return timeoutMs > 0 ? timeoutMs : null;
    }

    private void record(Algorithm algorithm, RetrievalStageResult result) {
        logger.debug("similarity_stage algorithm={} outcome={} took_ms={}", algorithm.tag(), result.outcome(),
            result.getTookMs());
        Metrics.counter("similarity.retrieval.total", "algorithm", algorithm.tag(), "outcome", result.outcome())
            .increment();
    }
}
