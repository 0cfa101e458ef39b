package com.simsuggest.similarity.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SnippetBuilderTest {

    @Test
    void cutsAtTwoHundredWhenNoLateSpace() {
        String input = "a".repeat(100) + " " + "b".repeat(399);

        String snippet = SnippetBuilder.build(input);

        assertThat(snippet).hasSize(201).endsWith("…");
        assertThat(snippet.substring(0, 200)).isEqualTo(input.substring(0, 200));
    }

    @Test
    void cutsAtLastSpaceBeyondOneHundredFifty() {
        String input = "a".repeat(180) + " " + "b".repeat(319);

        String snippet = SnippetBuilder.build(input);

        assertThat(snippet).isEqualTo("a".repeat(180) + "…");
    }

    @Test
    void shortTextIsReturnedWithoutEllipsis() {
        assertThat(SnippetBuilder.build("<p>Hello <b>world</b></p>\n\n   again")).isEqualTo("Hello world again");
    }

    @Test
    void blankContentGivesEmptySnippet() {
        assertThat(SnippetBuilder.build(null)).isEmpty();
        assertThat(SnippetBuilder.build("   ")).isEmpty();
    }

    @Test
    void countsCodePointsNotChars() {
        String input = "😀".repeat(250);

        String snippet = SnippetBuilder.build(input);

        assertThat(snippet.codePointCount(0, snippet.length())).isEqualTo(201);
    }
}
