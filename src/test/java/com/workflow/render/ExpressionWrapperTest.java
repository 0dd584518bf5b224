package com.workflow.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionWrapper.
 */
class ExpressionWrapperTest {

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "'${{ github.actor }}' => 'github.actor'",
            "'  ${{github.actor}}  ' => 'github.actor'",
            "'github.actor' => 'github.actor'",
            "'${{ github.actor' => '${{ github.actor'",
            "'${{}}' => ''"
    })
    @DisplayName("Strip removes a complete wrapper only")
    void shouldStrip(String input, String expected) {
        assertEquals(expected, ExpressionWrapper.strip(input));
    }

    @Test
    @DisplayName("Wrap then strip gives back the expression")
    void shouldWrap() {
        assertEquals("${{ a && b }}", ExpressionWrapper.wrap("a && b"));
        assertEquals("a && b", ExpressionWrapper.strip(ExpressionWrapper.wrap("a && b")));
    }

    @Test
    @DisplayName("Normalization collapses line breaks and space runs")
    void shouldNormalize() {
        assertEquals("a || b || c", ExpressionWrapper.normalizeForComparison("  a ||\n b ||\tc\n"));
        assertEquals(ExpressionWrapper.normalizeForComparison("a  &&   b"),
                ExpressionWrapper.normalizeForComparison("a &&\nb"));
    }
}
