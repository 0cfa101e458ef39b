package com.simsuggest.similarity.site;

import com.simsuggest.similarity.document.DocumentRef;

/**
 * Finds the site root a document belongs to.
 */
public interface SiteResolver {
    SitePartition resolvePartition(DocumentRef ref, int languageId) throws RoutingFailedException;
}
