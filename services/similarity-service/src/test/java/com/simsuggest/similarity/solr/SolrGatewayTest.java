package com.simsuggest.similarity.solr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.QueryDescriptor;
import com.simsuggest.similarity.query.SimilaritySettings;
import com.simsuggest.similarity.query.SourceDocument;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class SolrGatewayTest {
    private static final SolrPartition PARTITION = new SolrPartition(1, 0, "core_en");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SolrProperties properties = new SolrProperties();
    private MockRestServiceServer server;
    private SolrGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new SolrGateway(restTemplate, objectMapper, properties);
    }

    @Test
    void executePostsFormEncodedParametersToCoreHandler() throws Exception {
        QueryDescriptor descriptor = new QueryBuilder(properties)
            .lexical(SourceDocument.withBackendId(DocumentRef.page(5), "abc/pages/5"), SimilaritySettings.defaults(), 6);

        server.expect(requestTo("http://localhost:8983/solr/core_en/mlt"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                assertThat(body).contains("wt=json");
                assertThat(body).contains("mlt.match.include=false");
                assertThat(body).contains("rows=6");
                assertThat(request.getHeaders().getContentType().isCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                    .isTrue();
            })
            .andRespond(withSuccess("{\"response\":{\"numFound\":0,\"docs\":[]}}", MediaType.APPLICATION_JSON));

        RawBackendResponse raw = gateway.execute(PARTITION, descriptor);

        server.verify();
        assertThat(raw.getAlgorithm()).isEqualTo(Algorithm.LEXICAL);
        assertThat(raw.getBody().path("response").path("numFound").asInt()).isZero();
    }

    @Test
    void resolveDocumentIdReturnsIndexedId() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                assertThat(body).contains("fl=id");
                assertThat(body).contains("rows=1");
            })
            .andRespond(withSuccess(
                "{\"response\":{\"numFound\":1,\"docs\":[{\"id\":\"abc/pages/5\"}]}}",
                MediaType.APPLICATION_JSON
            ));

        assertThat(gateway.resolveDocumentId(PARTITION, DocumentRef.page(5), null)).contains("abc/pages/5");
    }

    @Test
    void notIndexedDocumentResolvesToEmpty() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andRespond(withSuccess("{\"response\":{\"numFound\":0,\"docs\":[]}}", MediaType.APPLICATION_JSON));

        assertThat(gateway.resolveDocumentId(PARTITION, DocumentRef.page(5), null)).isEmpty();
    }

    @Test
    void fetchSourceDocumentReturnsStoredFields() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andRespond(withSuccess(
                "{\"response\":{\"numFound\":1,\"docs\":[{\"title\":\"T\",\"content\":\"C\"}]}}",
                MediaType.APPLICATION_JSON
            ));

        Optional<JsonNode> doc = gateway.fetchSourceDocument(PARTITION, DocumentRef.page(5), null);

        assertThat(doc).isPresent();
        assertThat(doc.get().path("title").asText()).isEqualTo("T");
    }

    @Test
    void gatewayErrorsMapToUnavailable() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.resolveDocumentId(PARTITION, DocumentRef.page(5), null))
            .isInstanceOf(SolrUnavailableException.class);
    }

    @Test
    void queryErrorsMapToRequestException() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"error\":{}}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.resolveDocumentId(PARTITION, DocumentRef.page(5), null))
            .isInstanceOf(SolrRequestException.class);
    }

    @Test
    void malformedBodyIsRequestException() {
        server.expect(requestTo("http://localhost:8983/solr/core_en/select"))
            .andRespond(withSuccess("<html>proxy error</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> gateway.resolveDocumentId(PARTITION, DocumentRef.page(5), null))
            .isInstanceOf(SolrRequestException.class);
    }
}
