package com.simsuggest.similarity.text;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;

public final class PlainText {
    public static final String ELLIPSIS = "…";

    private PlainText() {
    }

    /**
     * Drops markup, decodes entities and collapses whitespace runs to single spaces.
     */
    public static String fromMarkup(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return Jsoup.parse(value).text().trim();
    }

    /**
     * Reads a stored field that may be single- or multi-valued. Multi-valued text is joined with spaces.
     */
    public static String fieldText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) {
                    parts.add(item.asText(""));
                }
            }
            return String.join(" ", parts);
        }
        if (node.isValueNode()) {
            return node.asText("");
        }
        return "";
    }

    /**
     * First value of a possibly multi-valued field.
     */
    public static String firstValue(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) {
                    return item.asText("");
                }
            }
            return "";
        }
        return node.isValueNode() ? node.asText("") : "";
    }

    /**
     * Cuts to at most {@code maxCodePoints} code points.
     */
    public static String truncate(String value, int maxCodePoints) {
        if (value.codePointCount(0, value.length()) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }
}
