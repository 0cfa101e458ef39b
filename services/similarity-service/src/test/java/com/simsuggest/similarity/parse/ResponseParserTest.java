package com.simsuggest.similarity.parse;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.query.Algorithm;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.solr.RawBackendResponse;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResponseParserTest {
    private static final String DOCS = "{\"numFound\":2,\"docs\":["
        + "{\"id\":\"s/pages/5\",\"type\":\"pages\",\"uid\":5,\"pid\":1,\"title\":\"Five\",\"url\":\"/five\","
        + "\"content\":\"<p>Body five</p>\",\"score\":3.5},"
        + "{\"id\":\"s/news/9\",\"type\":\"tx_news_domain_model_news\",\"uid\":\"9\",\"pid\":4,"
        + "\"title\":[\"Nine\"],\"url\":[\"/nine\"],\"score\":1.25}"
        + "]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseParser parser = new ResponseParser();
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        Metrics.addRegistry(registry);
    }

    @AfterEach
    void tearDown() {
        Metrics.removeRegistry(registry);
    }

    @Test
    void threeSectionShapesYieldIdenticalCandidates() throws Exception {
        List<Candidate> flat = parse("{\"moreLikeThis\":[\"src-1\"," + DOCS + "]}");
        List<Candidate> keyed = parse("{\"moreLikeThis\":{\"src-1\":" + DOCS + "}}");
        List<Candidate> direct = parse("{\"match\":{\"numFound\":1,\"docs\":[]},\"response\":" + DOCS + "}");

        assertThat(flat).hasSize(2);
        assertThat(describe(flat)).isEqualTo(describe(keyed)).isEqualTo(describe(direct));
    }

    @Test
    void normalizesDocumentFields() throws Exception {
        List<Candidate> candidates = parse("{\"response\":" + DOCS + "}");

        Candidate first = candidates.get(0);
        assertThat(first.getDocumentRef()).isEqualTo(DocumentRef.page(5));
        assertThat(first.getTitle()).isEqualTo("Five");
        assertThat(first.getSnippet()).isEqualTo("Body five");
        assertThat(first.getScore()).isEqualTo(3.5);
        assertThat(first.getContainerId()).isEqualTo(1);
        assertThat(first.getAlgorithmOrigin()).isEqualTo("lexical");

        Candidate second = candidates.get(1);
        assertThat(second.getDocumentRef()).isEqualTo(new DocumentRef("tx_news_domain_model_news", 9));
        assertThat(second.getTitle()).isEqualTo("Nine");
        assertThat(second.getUrl()).isEqualTo("/nine");
        assertThat(second.getTypeLabel()).isEqualTo("News news");
    }

    @Test
    void keyedShapePrefersTheSourceDocumentsEntry() throws Exception {
        String body = "{\"moreLikeThis\":{\"other\":{\"docs\":[{\"uid\":77,\"score\":1}]},\"src-1\":" + DOCS + "}}";

        assertThat(parse(body)).extracting(Candidate::getId).containsExactly(5, 9);
    }

    @Test
    void missingTypeDefaultsToPagesAndMissingUidIsSkipped() throws Exception {
        List<Candidate> candidates = parse("{\"response\":{\"docs\":[{\"uid\":3},{\"title\":\"no uid\"}]}}");

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getType()).isEqualTo("pages");
        assertThat(candidates.get(0).getScore()).isZero();
    }

    @Test
    void unlocatableDocsGiveEmptyResultAndCountDiagnostic() throws Exception {
        RawBackendResponse raw = new RawBackendResponse(Algorithm.VECTOR, objectMapper.readTree("{\"error\":{\"msg\":\"x\"}}"));

        assertThat(parser.parse(raw, null)).isEmpty();
        assertThat(parser.tryParse(raw, null)).isEmpty();
        assertThat(registry.get("similarity.parse.unlocatable").tag("algorithm", "vector").counter().count())
            .isEqualTo(2.0);
    }

    private List<Candidate> parse(String json) throws Exception {
        return parser.parse(new RawBackendResponse(Algorithm.LEXICAL, objectMapper.readTree(json)), "src-1");
    }

    private static List<String> describe(List<Candidate> candidates) {
        return candidates.stream()
            .map(c -> c.getDocumentRef().key() + "|" + c.getTitle() + "|" + c.getUrl() + "|" + c.getScore() + "|"
                + c.getSnippet() + "|" + c.getContainerId())
            .toList();
    }
}
