package com.simsuggest.similarity.text;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PlainTextTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsSingleAndMultiValuedFields() throws Exception {
        JsonNode doc = objectMapper.readTree("{\"title\":[\"First\",\"Second\"],\"url\":\"/a\",\"content\":[\"x\",\"y\"]}");

        assertThat(PlainText.firstValue(doc.get("title"))).isEqualTo("First");
        assertThat(PlainText.firstValue(doc.get("url"))).isEqualTo("/a");
        assertThat(PlainText.fieldText(doc.get("content"))).isEqualTo("x y");
        assertThat(PlainText.firstValue(doc.get("missing"))).isEmpty();
    }

    @Test
    void typeLabelsFollowRecordTableNames() {
        assertThat(TypeLabels.of("tx_news_domain_model_news")).isEqualTo("News news");
        assertThat(TypeLabels.of("pages")).isEqualTo("Pages");
        assertThat(TypeLabels.of("")).isEmpty();
    }

    @Test
    void sourceTextJoinsTitleAndStrippedBody() throws Exception {
        JsonNode doc = objectMapper.readTree("{\"title\":\"Solar\",\"content\":[\"<p>Panels</p>\",\"and  roofs\"]}");

        assertThat(SourceTextExtractor.extract(doc)).contains("Solar Panels and roofs");
    }

    @Test
    void sourceTextIsTruncated() throws Exception {
        JsonNode doc = objectMapper.readTree("{\"content\":\"" + "w".repeat(2500) + "\"}");

        assertThat(SourceTextExtractor.extract(doc).orElseThrow()).hasSize(SourceTextExtractor.MAX_SOURCE_TEXT_LENGTH);
    }

    @Test
    void documentWithoutTextHasNoSourceText() throws Exception {
        assertThat(SourceTextExtractor.extract(objectMapper.readTree("{\"title\":\"\",\"content\":\"<br/>\"}"))).isEmpty();
    }
}
