package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.parse.ResponseParser;
import com.simsuggest.similarity.query.InvalidConfigurationException;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.QueryDescriptor;
import com.simsuggest.similarity.query.SourceDocument;
import com.simsuggest.similarity.solr.RawBackendResponse;
import com.simsuggest.similarity.solr.SolrGateway;
import com.simsuggest.similarity.solr.SolrRequestException;
import com.simsuggest.similarity.solr.SolrUnavailableException;
import java.util.List;
import java.util.Optional;

/**
 * Shared flow of the Solr-backed retrievers: load what the query needs about the source document, build the
 * descriptor, execute, parse.
 */
abstract class AbstractSolrRetriever implements Retriever {
    protected final SolrGateway solrGateway;
    protected final QueryBuilder queryBuilder;
    protected final ResponseParser responseParser;

    protected AbstractSolrRetriever(SolrGateway solrGateway, QueryBuilder queryBuilder, ResponseParser responseParser) {
        this.solrGateway = solrGateway;
        this.queryBuilder = queryBuilder;
        this.responseParser = responseParser;
    }

    /**
     * Empty when the source document is not in the index.
     */
    protected abstract Optional<SourceDocument> loadSource(RetrievalStageContext context);

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        if (context == null || context.getRows() <= 0) {
            return RetrievalStageResult.success(List.of(), 0L);
        }
        long started = System.nanoTime();
        try {
            Optional<SourceDocument> source = loadSource(context);
            if (source.isEmpty()) {
                return RetrievalStageResult.notIndexed();
            }
            QueryDescriptor descriptor = queryBuilder.build(algorithm(), source.get(), context.getSettings(), context.getRows());
            RawBackendResponse raw = solrGateway.execute(context.getPartition(), descriptor, context.getTimeBudgetMs());
            Optional<List<Candidate>> candidates = responseParser.tryParse(raw, descriptor.getSourceBackendId());
            if (candidates.isEmpty()) {
                return RetrievalStageResult.error(RetrievalError.UNPARSABLE_RESPONSE, "docs_unlocatable");
            }
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            return RetrievalStageResult.success(candidates.get(), tookMs);
        } catch (InvalidConfigurationException e) {
            throw e;
        } catch (SolrUnavailableException e) {
            return RetrievalStageResult.error(RetrievalError.BACKEND_UNAVAILABLE, e.getMessage());
        } catch (SolrRequestException e) {
            return RetrievalStageResult.error(RetrievalError.BACKEND_QUERY_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            return RetrievalStageResult.error(RetrievalError.BACKEND_QUERY_ERROR, e.getMessage());
        }
    }

    protected Optional<SourceDocument> loadBackendId(RetrievalStageContext context) {
        return solrGateway.resolveDocumentId(context.getPartition(), context.getRef(), context.getTimeBudgetMs())
            .map(id -> SourceDocument.withBackendId(context.getRef(), id));
    }
}
