package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.query.SimilaritySettings;
import com.simsuggest.similarity.solr.SolrPartition;

public class RetrievalStageContext {
    private final DocumentRef ref;
    private final SolrPartition partition;
    private final SimilaritySettings settings;
    private final int rows;
    private final Integer timeBudgetMs;

    public RetrievalStageContext(
        DocumentRef ref,
        SolrPartition partition,
        SimilaritySettings settings,
        int rows,
        Integer timeBudgetMs
    ) {
        this.ref = ref;
        this.partition = partition;
        this.settings = settings;
        this.rows = rows;
        this.timeBudgetMs = timeBudgetMs;
    }

    public DocumentRef getRef() {
        return ref;
    }

    public SolrPartition getPartition() {
        return partition;
    }

    public SimilaritySettings getSettings() {
        return settings;
    }

    public int getRows() {
        return rows;
    }

    public Integer getTimeBudgetMs() {
        return timeBudgetMs;
    }
}
