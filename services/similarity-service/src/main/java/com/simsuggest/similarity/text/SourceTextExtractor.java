package com.simsuggest.similarity.text;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

public final class SourceTextExtractor {
    /** Embedding models reject long inputs. */
    public static final int MAX_SOURCE_TEXT_LENGTH = 2000;

    private SourceTextExtractor() {
    }

    /**
     * Title and body of an indexed document as one plain-text string, or empty when both are blank.
     */
    public static Optional<String> extract(JsonNode doc) {
        if (doc == null || doc.isMissingNode() || doc.isNull()) {
            return Optional.empty();
        }
        String title = PlainText.fieldText(doc.path("title")).trim();
        String content = PlainText.fromMarkup(PlainText.fieldText(doc.path("content")));
        String text = (title + " " + content).trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PlainText.truncate(text, MAX_SOURCE_TEXT_LENGTH));
    }
}
