package com.simsuggest.similarity.persistence;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.retrieval.RankedResultSet;

/**
 * Stores precomputed suggestions. Saving the same key twice replaces the earlier rows.
 */
public interface SimilaritySink {
    /**
     * @return number of stored suggestion rows
     */
    int replace(DocumentRef source, int rootContainerId, int languageId, RankedResultSet results);
}
