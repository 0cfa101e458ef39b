package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.parse.ResponseParser;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.SourceDocument;
import com.simsuggest.similarity.solr.SolrGateway;
import com.simsuggest.similarity.text.SourceTextExtractor;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Nearest neighbours of the source document's text. The backend embeds the text with its configured model, so a
 * document without title or body text has nothing to search with and is treated as not indexed.
 */
@Component
public class VectorRetriever extends AbstractSolrRetriever {

    public VectorRetriever(SolrGateway solrGateway, QueryBuilder queryBuilder, ResponseParser responseParser) {
        super(solrGateway, queryBuilder, responseParser);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.VECTOR;
    }

    @Override
    protected Optional<SourceDocument> loadSource(RetrievalStageContext context) {
        return solrGateway.fetchSourceDocument(context.getPartition(), context.getRef(), context.getTimeBudgetMs())
            .flatMap(SourceTextExtractor::extract)
            .map(text -> SourceDocument.withText(context.getRef(), text));
    }
}
