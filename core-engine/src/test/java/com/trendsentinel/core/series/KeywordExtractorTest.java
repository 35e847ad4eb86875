package com.trendsentinel.core.series;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeywordExtractor}.
 */
class KeywordExtractorTest {

    @Test
    @DisplayName("Should split on separators and drop short tokens and stop-words")
    void shouldTokenize() {
        assertThat(KeywordExtractor.extract("Checkout-errors for the mobile_app"))
                .containsExactly("checkout", "errors", "mobile");
    }

    @Test
    @DisplayName("Should rank by frequency, keeping first appearance on ties")
    void shouldRankByFrequency() {
        List<String> keywords = KeywordExtractor.extract(List.of(
                "pasta recipe views", "recipe saves", "recipe pasta"));

        assertThat(keywords).containsExactly("recipe", "pasta", "views", "saves");
    }

    @Test
    @DisplayName("Should keep at most ten keywords")
    void shouldLimitToTen() {
        String label = "alpha bravo charlie delta echoes foxtrot golf1 hotel india juliet kilo1 lima1";

        assertThat(KeywordExtractor.extract(label)).hasSize(10);
    }
}
