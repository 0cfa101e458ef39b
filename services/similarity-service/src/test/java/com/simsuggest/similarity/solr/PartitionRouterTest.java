package com.simsuggest.similarity.solr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.site.RoutingFailedException;
import com.simsuggest.similarity.site.SitePartition;
import com.simsuggest.similarity.site.SiteResolver;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PartitionRouterTest {

    @Mock
    private SiteResolver siteResolver;

    private SolrProperties solrProperties;
    private RoutingProperties routingProperties;
    private PartitionRouter router;

    @BeforeEach
    void setUp() {
        solrProperties = new SolrProperties();
        solrProperties.setCores(new ArrayList<>(List.of(
            new SolrProperties.Core(10, 0, "site10_en"),
            new SolrProperties.Core(10, 1, "site10_de"),
            new SolrProperties.Core(20, 0, "site20_en")
        )));
        routingProperties = new RoutingProperties();
        router = new PartitionRouter(siteResolver, solrProperties, routingProperties);
    }

    @Test
    void routesToCoreOfResolvedRootAndLanguage() {
        when(siteResolver.resolvePartition(DocumentRef.page(5), 1)).thenReturn(new SitePartition(10, 1));

        SolrPartition partition = router.route(DocumentRef.page(5), 1);

        assertThat(partition).isEqualTo(new SolrPartition(10, 1, "site10_de"));
    }

    @Test
    void fallsBackToFirstConfiguredRoot() {
        when(siteResolver.resolvePartition(any(), anyInt())).thenThrow(new RoutingFailedException("no rootline"));

        assertThat(router.route(DocumentRef.page(5), 0).core()).isEqualTo("site10_en");
    }

    @Test
    void fallsBackToDefaultRootWithoutConfiguredCores() {
        solrProperties.setCores(new ArrayList<>());
        routingProperties.setDefaultRootId(1);
        when(siteResolver.resolvePartition(any(), anyInt())).thenThrow(new RoutingFailedException("no rootline"));

        assertThatThrownBy(() -> router.route(DocumentRef.page(5), 0))
            .isInstanceOf(RoutingFailedException.class)
            .hasMessageContaining("root=1");
    }

    @Test
    void missingCoreForLanguageIsRoutingFailure() {
        when(siteResolver.resolvePartition(DocumentRef.page(5), 3)).thenReturn(new SitePartition(20, 3));

        assertThatThrownBy(() -> router.route(DocumentRef.page(5), 3)).isInstanceOf(RoutingFailedException.class);
    }

    @Test
    void listsDistinctRoots() {
        assertThat(router.availableRootIds()).containsExactly(10, 20);
    }
}
