package com.simsuggest.similarity.retrieval;

import com.simsuggest.similarity.query.Algorithm;

public interface Retriever {
    Algorithm algorithm();

    /**
     * Runs one sub-query. Backend failures come back as error results; only
     * {@link com.simsuggest.similarity.query.InvalidConfigurationException} is thrown.
     */
    RetrievalStageResult retrieve(RetrievalStageContext context);
}
