package com.document.verification.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Confidence combining")
class ConfidenceCombinerTest {

    @Nested
    @DisplayName("CombinerWeights")
    class WeightsTests {

        @Test
        @DisplayName("Default weights are 0.55 similarity and 0.45 confidence")
        void defaultWeights() {
            CombinerWeights weights = CombinerWeights.defaultWeights();
            assertEquals(0.55, weights.similarityWeight());
            assertEquals(0.45, weights.confidenceWeight());
        }

        @Test
        @DisplayName("Should reject weights that do not sum to 1.0")
        void rejectBadSum() {
            assertThrows(IllegalArgumentException.class, () -> new CombinerWeights(0.5, 0.6));
        }

        @Test
        @DisplayName("Should reject negative weights")
        void rejectNegative() {
            assertThrows(IllegalArgumentException.class, () -> new CombinerWeights(1.2, -0.2));
        }
    }

    @Nested
    @DisplayName("ConfidenceCombiner")
    class CombinerTests {

        private final ConfidenceCombiner combiner = new ConfidenceCombiner();

        @Test
        @DisplayName("Zero confidence means similarity alone")
        void zeroConfidenceUsesSimilarity() {
            assertEquals(66.67, combiner.combine(66.67, 0.0));
        }

        @ParameterizedTest
        @DisplayName("Positive confidence blends with default weights")
        @CsvSource({
                "90.0,80.0,85.5",
                "100.0,60.0,82.0",
                "100.0,100.0,100.0",
                "0.0,50.0,22.5"
        })
        void blends(double similarity, double confidence, double expected) {
            assertEquals(expected, combiner.combine(similarity, confidence), 1e-9);
        }

        @Test
        @DisplayName("Custom weights are applied")
        void customWeights() {
            ConfidenceCombiner custom = new ConfidenceCombiner(new CombinerWeights(0.5, 0.5));
            assertEquals(75.0, custom.combine(100.0, 50.0), 1e-9);
            assertEquals(0.5, custom.getWeights().similarityWeight());
        }
    }

    @Nested
    @DisplayName("Scores")
    class ScoresTests {

        @ParameterizedTest
        @DisplayName("Rounds half up to two decimals")
        @CsvSource({
                "66.666666,66.67",
                "85.50000000000001,85.5",
                "74.995,75.0",
                "0.004,0.0"
        })
        void round2(double input, double expected) {
            assertEquals(expected, Scores.round2(input));
        }

        @Test
        @DisplayName("Non-finite values round to zero")
        void nonFinite() {
            assertEquals(0.0, Scores.round2(Double.NaN));
            assertEquals(0.0, Scores.round2(Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("Clamps into the percentage range")
        void clamp() {
            assertEquals(0.0, Scores.clamp(-5.0));
            assertEquals(100.0, Scores.clamp(150.0));
            assertEquals(42.0, Scores.clamp(42.0));
        }

        @Test
        @DisplayName("Formats with exactly two decimals")
        void format() {
            assertEquals("0.00", Scores.format(0.0));
            assertEquals("85.50", Scores.format(85.5));
            assertEquals("100.00", Scores.format(100.0));
            assertEquals("66.67", Scores.format(66.666666));
        }
    }
}
