package com.simsuggest.similarity.solr;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.site.RoutingFailedException;
import com.simsuggest.similarity.site.SiteResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a document and language to the Solr core that indexes it.
 *
 * <p>When the site cannot be resolved the router falls back to the first configured root, then to
 * {@code similarity.routing.default-root-id}. The language is never swapped: a missing core for the requested
 * language is a {@link RoutingFailedException}, which callers turn into "no suggestions".
 */
@Component
public class PartitionRouter {
    private static final Logger logger = LoggerFactory.getLogger(PartitionRouter.class);

    private final SiteResolver siteResolver;
    private final SolrProperties solrProperties;
    private final RoutingProperties routingProperties;

    public PartitionRouter(SiteResolver siteResolver, SolrProperties solrProperties, RoutingProperties routingProperties) {
        this.siteResolver = siteResolver;
        this.solrProperties = solrProperties;
        this.routingProperties = routingProperties;
    }

    public SolrPartition route(DocumentRef ref, int languageId) {
        int rootId = resolveRootId(ref, languageId);
        return partitionFor(rootId, languageId)
            .orElseThrow(() -> new RoutingFailedException(
                "no Solr core configured for root=" + rootId + " language=" + languageId
            ));
    }

    public Optional<SolrPartition> partitionFor(int rootId, int languageId) {
        for (SolrProperties.Core core : solrProperties.getCores()) {
            if (core.getRootId() == rootId && core.getLanguageId() == languageId
                && core.getName() != null && !core.getName().isBlank()) {
                return Optional.of(new SolrPartition(rootId, languageId, core.getName()));
            }
        }
        return Optional.empty();
    }

    public List<Integer> availableRootIds() {
        List<Integer> roots = new ArrayList<>();
        for (SolrProperties.Core core : solrProperties.getCores()) {
            if (!roots.contains(core.getRootId())) {
                roots.add(core.getRootId());
            }
        }
        return roots;
    }

    private int resolveRootId(DocumentRef ref, int languageId) {
        try {
            return siteResolver.resolvePartition(ref, languageId).rootContainerId();
        } catch (RoutingFailedException e) {
            List<Integer> roots = availableRootIds();
            if (!roots.isEmpty()) {
                logger.warn("partition_route_fallback doc={} language={} root={} reason={}",
                    ref.key(), languageId, roots.get(0), e.getMessage());
                return roots.get(0);
            }
            int fallback = routingProperties.getDefaultRootId();
            logger.warn("partition_route_default doc={} language={} root={} reason={}",
                ref.key(), languageId, fallback, e.getMessage());
            return fallback;
        }
    }
}
