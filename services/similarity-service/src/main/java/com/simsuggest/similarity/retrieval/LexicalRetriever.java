package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.parse.ResponseParser;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.SourceDocument;
import com.simsuggest.similarity.solr.SolrGateway;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class LexicalRetriever extends AbstractSolrRetriever {

    public LexicalRetriever(SolrGateway solrGateway, QueryBuilder queryBuilder, ResponseParser responseParser) {
        super(solrGateway, queryBuilder, responseParser);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.LEXICAL;
    }

    @Override
    protected Optional<SourceDocument> loadSource(RetrievalStageContext context) {
        return loadBackendId(context);
    }
}
