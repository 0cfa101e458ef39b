package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.parse.ResponseParser;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.SourceDocument;
import com.simsuggest.similarity.solr.SolrGateway;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Single request to the semantic more-like-this handler, which fuses lexical and vector scores itself.
 */
@Component
public class NativeHybridRetriever extends AbstractSolrRetriever {

    public NativeHybridRetriever(SolrGateway solrGateway, QueryBuilder queryBuilder, ResponseParser responseParser) {
        super(solrGateway, queryBuilder, responseParser);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.HYBRID_NATIVE;
    }

    @Override
    protected Optional<SourceDocument> loadSource(RetrievalStageContext context) {
        return loadBackendId(context);
    }
}
