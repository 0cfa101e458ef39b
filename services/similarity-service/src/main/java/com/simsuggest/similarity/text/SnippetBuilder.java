package com.simsuggest.similarity.text;

/**
 * Builds the display snippet: plain text, at most 200 characters, cut at the last space when that space lies past
 * character 150, followed by an ellipsis whenever anything was cut.
 */
public final class SnippetBuilder {
    public static final int MAX_LENGTH = 200;
    static final int MIN_BREAK_POSITION = 150;

    private SnippetBuilder() {
    }

    public static String build(String content) {
        String text = PlainText.fromMarkup(content);
        if (text.codePointCount(0, text.length()) <= MAX_LENGTH) {
            return text;
        }
        String cut = PlainText.truncate(text, MAX_LENGTH);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace >= 0 && cut.codePointCount(0, lastSpace) > MIN_BREAK_POSITION) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + PlainText.ELLIPSIS;
    }
}
