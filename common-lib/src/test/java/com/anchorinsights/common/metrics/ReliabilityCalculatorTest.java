package com.anchorinsights.common.metrics;

import com.anchorinsights.common.model.AnchorStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReliabilityCalculatorTest {

    @Nested
    @DisplayName("failureRate()")
    class FailureRateTests {

        @Test
        @DisplayName("zero total → 0.0")
        void zeroTotal() {
            assertEquals(0.0, ReliabilityCalculator.failureRate(0, 0));
        }

        @Test
        @DisplayName("stored counters (100, 90, 10) → 10%")
        void storedCounters() {
            assertEquals(10.0, ReliabilityCalculator.failureRate(100, 10), 1e-9);
        }

        @Test
        @DisplayName("always within [0, 100] for non-negative counts")
        void alwaysInRange() {
            for (long total = 0; total <= 50; total++) {
                for (long failed = 0; failed <= 60; failed += 3) {
                    double rate = ReliabilityCalculator.failureRate(total, failed);
                    assertTrue(rate >= 0.0 && rate <= 100.0,
                        "failureRate out of range for total=" + total + " failed=" + failed + ": " + rate);
                }
            }
        }
    }

    @Nested
    @DisplayName("reliabilityScore()")
    class ReliabilityScoreTests {

        @Test
        @DisplayName("live counts: 5 of 5 → 100")
        void allSuccessful() {
            assertEquals(100.0, ReliabilityCalculator.reliabilityScore(5, 5, 42.0));
        }

        @Test
        @DisplayName("stored counts (100, 90) → 90")
        void storedCounts() {
            assertEquals(90.0, ReliabilityCalculator.reliabilityScore(100, 90, 42.0), 1e-9);
        }

        @Test
        @DisplayName("zero total keeps the stored score instead of defaulting to 0")
        void zeroTotalKeepsStoredScore() {
            assertEquals(97.5, ReliabilityCalculator.reliabilityScore(0, 0, 97.5));
        }

        @Test
        @DisplayName("always within [0, 100] when total > 0")
        void alwaysInRange() {
            for (long total = 1; total <= 40; total++) {
                for (long ok = 0; ok <= 45; ok += 5) {
                    double score = ReliabilityCalculator.reliabilityScore(total, ok, 0.0);
                    assertTrue(score >= 0.0 && score <= 100.0,
                        "reliabilityScore out of range for total=" + total + " ok=" + ok + ": " + score);
                }
            }
        }
    }

    @Nested
    @DisplayName("classifyStatus() boundaries")
    class StatusTests {

        @Test
        @DisplayName("99.0 → green")
        void exactlyGreen() {
            assertEquals(AnchorStatus.GREEN, ReliabilityCalculator.classifyStatus(99.0));
        }

        @Test
        @DisplayName("98.999 → yellow")
        void justBelowGreen() {
            assertEquals(AnchorStatus.YELLOW, ReliabilityCalculator.classifyStatus(98.999));
        }

        @Test
        @DisplayName("95.0 → yellow")
        void exactlyYellow() {
            assertEquals(AnchorStatus.YELLOW, ReliabilityCalculator.classifyStatus(95.0));
        }

        @Test
        @DisplayName("94.999 → red")
        void justBelowYellow() {
            assertEquals(AnchorStatus.RED, ReliabilityCalculator.classifyStatus(94.999));
        }

        @Test
        @DisplayName("labels serialize lower-case")
        void labels() {
            assertEquals("green", AnchorStatus.GREEN.label());
            assertEquals("yellow", AnchorStatus.YELLOW.label());
            assertEquals("red", AnchorStatus.RED.label());
        }
    }
}
