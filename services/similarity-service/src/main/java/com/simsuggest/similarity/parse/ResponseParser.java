package com.simsuggest.similarity.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.solr.RawBackendResponse;
import com.simsuggest.similarity.text.PlainText;
import com.simsuggest.similarity.text.SnippetBuilder;
import com.simsuggest.similarity.text.TypeLabels;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a backend response into candidates in backend rank order. The docs array may sit in one of several
 * sections and each section may be encoded in one of several shapes; sections are searched in a fixed order and
 * each is offered to the shape strategies in turn.
 */
@Component
public class ResponseParser {
    private static final Logger logger = LoggerFactory.getLogger(ResponseParser.class);
    private static final List<String> SECTIONS = List.of("moreLikeThis", "response");

    private final List<SectionStrategy> strategies;

    public ResponseParser() {
        this(List.of(new FlatPairsSectionStrategy(), new KeyedSectionStrategy(), new DirectDocsSectionStrategy()));
    }

    ResponseParser(List<SectionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<Candidate> parse(RawBackendResponse raw, String sourceBackendId) {
        return tryParse(raw, sourceBackendId).orElse(List.of());
    }

    /**
     * Like {@link #parse} but reports a response whose docs could not be located as empty, so callers can tell
     * it apart from a response that simply had no hits.
     */
    public Optional<List<Candidate>> tryParse(RawBackendResponse raw, String sourceBackendId) {
        JsonNode body = raw == null ? null : raw.getBody();
        if (body == null || !body.isObject()) {
            return unlocatable(raw, body);
        }
        Optional<JsonNode> docs = locateDocs(body, sourceBackendId);
        if (docs.isEmpty()) {
            return unlocatable(raw, body);
        }
        String origin = raw.getAlgorithm().tag();
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode doc : docs.get()) {
            Candidate candidate = toCandidate(doc, origin);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return Optional.of(candidates);
    }

    private Optional<JsonNode> locateDocs(JsonNode body, String sourceBackendId) {
        List<JsonNode> sections = new ArrayList<>();
        for (String name : SECTIONS) {
            JsonNode section = body.get(name);
            if (section != null && !section.isNull()) {
                sections.add(section);
            }
        }
        sections.add(body);
        for (JsonNode section : sections) {
            for (SectionStrategy strategy : strategies) {
                Optional<JsonNode> docs = strategy.locateDocs(section, sourceBackendId);
                if (docs.isPresent()) {
                    return docs;
                }
            }
        }
        return Optional.empty();
    }

    private Candidate toCandidate(JsonNode doc, String origin) {
        if (doc == null || !doc.isObject()) {
            return null;
        }
        int uid = intValue(doc.get("uid"));
        if (uid <= 0) {
            logger.debug("parse_doc_skipped reason=missing_uid id={}", PlainText.firstValue(doc.get("id")));
            return null;
        }
        String type = PlainText.firstValue(doc.get("type"));
        if (type.isBlank()) {
            type = DocumentRef.PAGES;
        }
        return new Candidate(
            new DocumentRef(type, uid),
            PlainText.firstValue(doc.get("title")),
            PlainText.firstValue(doc.get("url")),
            TypeLabels.of(type),
            SnippetBuilder.build(PlainText.fieldText(doc.get("content"))),
            intValue(doc.get("pid")),
            doc.path("score").asDouble(0.0),
            null,
            null,
            origin
        );
    }

    private Optional<List<Candidate>> unlocatable(RawBackendResponse raw, JsonNode body) {
        String algorithm = raw == null || raw.getAlgorithm() == null ? "unknown" : raw.getAlgorithm().tag();
        logger.warn("parse_docs_unlocatable algorithm={} top_level_keys={}", algorithm, topLevelKeys(body));
        Metrics.counter("similarity.parse.unlocatable", "algorithm", algorithm).increment();
        return Optional.empty();
    }

    private static List<String> topLevelKeys(JsonNode body) {
        List<String> keys = new ArrayList<>();
        if (body != null && body.isObject()) {
            Iterator<String> names = body.fieldNames();
            names.forEachRemaining(keys::add);
        }
        return keys;
    }

    private static int intValue(JsonNode node) {
        String value = PlainText.firstValue(node).trim();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
