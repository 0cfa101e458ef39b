package com.simsuggest.similarity.solr;

/**
 * A Solr core scoped to one site root and one language.
 */
public record SolrPartition(int rootContainerId, int languageId, String core) {
}
