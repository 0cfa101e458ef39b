package com.simsuggest.similarity.solr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.query.QueryBuilder;
import com.simsuggest.similarity.query.QueryDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class SolrGateway {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SolrProperties properties;

    public SolrGateway(
        @Qualifier("solrRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        SolrProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public RawBackendResponse execute(SolrPartition partition, QueryDescriptor descriptor) {
        return execute(partition, descriptor, null);
    }

    public RawBackendResponse execute(SolrPartition partition, QueryDescriptor descriptor, Integer timeBudgetMs) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        for (Map.Entry<String, List<String>> entry : descriptor.getParams().entrySet()) {
            params.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        JsonNode body = postForm(partition, descriptor.getHandler(), params, timeBudgetMs);
        return new RawBackendResponse(descriptor.getAlgorithm(), body);
    }

    /**
     * Looks up the backend id of an indexed record. Empty means the record is not indexed.
     */
    public Optional<String> resolveDocumentId(SolrPartition partition, DocumentRef ref, Integer timeBudgetMs) {
        return firstDoc(partition, ref, "id", timeBudgetMs)
            .map(doc -> doc.path("id").asText(null))
            .filter(id -> !id.isEmpty());
    }

    public Optional<JsonNode> fetchSourceDocument(SolrPartition partition, DocumentRef ref, Integer timeBudgetMs) {
        return firstDoc(partition, ref, "title,content", timeBudgetMs);
    }

    private Optional<JsonNode> firstDoc(SolrPartition partition, DocumentRef ref, String fields, Integer timeBudgetMs) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("q", QueryBuilder.pointLookupQuery(ref));
        params.add("fl", fields);
        params.add("rows", "1");

        JsonNode response = postForm(partition, properties.getSelectHandler(), params, timeBudgetMs);
        JsonNode section = response.path("response");
        if (section.path("numFound").asLong(0L) == 0L) {
            return Optional.empty();
        }
        JsonNode docs = section.path("docs");
        if (!docs.isArray() || docs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(docs.get(0));
    }

    private JsonNode postForm(
        SolrPartition partition,
        String handler,
        MultiValueMap<String, String> params,
        Integer timeBudgetMs
    ) {
        String url = buildUrl(partition.core(), handler);
        params.set("wt", "json");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            HttpEntity<MultiValueMap<String, String>> entity = new HttpEntity<>(params, headers);
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response = client.exchange(url, HttpMethod.POST, entity, String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new SolrRequestException("Empty Solr response: " + url);
            }
            return objectMapper.readTree(body);
        } catch (ResourceAccessException e) {
            throw new SolrUnavailableException("Solr unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new SolrUnavailableException("Solr unavailable: " + status, e);
            }
            throw new SolrRequestException("Solr error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new SolrRequestException("Failed to parse Solr response", e);
        }
    }

    private String buildUrl(String core, String handler) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = handler == null || handler.isEmpty() ? properties.getSelectHandler() : handler;
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return base + "/" + core + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(timeBudgetMs, properties.getConnectTimeoutMs()));
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }
}
