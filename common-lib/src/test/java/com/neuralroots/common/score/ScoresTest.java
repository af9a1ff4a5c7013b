package com.neuralroots.common.score;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoresTest {

    @Nested
    @DisplayName("clampScore()")
    class ClampScoreTests {

        @Test
        @DisplayName("values inside [0, 100] pass through")
        void inside() {
            assertEquals(42.5, Scores.clampScore(42.5));
        }

        @Test
        @DisplayName("negative → 0, above 100 → 100")
        void outside() {
            assertEquals(0.0, Scores.clampScore(-12.0));
            assertEquals(100.0, Scores.clampScore(180.0));
        }

        @Test
        @DisplayName("NaN collapses to 0")
        void nan() {
            assertEquals(0.0, Scores.clampScore(Double.NaN));
        }
    }

    @Nested
    @DisplayName("round2()")
    class RoundTests {

        @Test
        @DisplayName("rounds half up on the second decimal")
        void halfUp() {
            assertEquals(88.57, Scores.round2(88.5714285));
            assertEquals(0.13, Scores.round2(0.125));
        }

        @Test
        @DisplayName("non-finite values are returned unchanged")
        void nonFinite() {
            assertTrue(Double.isNaN(Scores.round2(Double.NaN)));
            assertEquals(Double.POSITIVE_INFINITY, Scores.round2(Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("round(value, 4) keeps four decimals")
        void fourDecimals() {
            assertEquals(1.14, Scores.round(1.2 * 0.95, 4));
            assertEquals(0.8208, Scores.round(0.95 * 0.92 * 0.95 * 0.98857, 4));
        }
    }
}
