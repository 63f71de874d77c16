package com.purchasingpower.storyflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Quality Vector Tests")
class QualityVectorTest {

    @Test
    @DisplayName("Overall weights should sum to exactly 1.0")
    void testOverallWeights_ShouldSumToOne() {
        double total = 0.0;
        for (QualityDimension dimension : QualityDimension.values()) {
            total += dimension.getOverallWeight();
        }
        assertEquals(1.0, total, 1e-9);
    }

    @Test
    @DisplayName("Uniform vector should have the same overall score")
    void testUniform_ShouldHaveMatchingOverall() {
        assertEquals(7.5, QualityVector.uniform(7.5).getOverall(), 1e-9);
        assertEquals(0.0, QualityVector.uniform(0.0).getOverall(), 1e-9);
        assertEquals(10.0, QualityVector.uniform(10.0).getOverall(), 1e-9);
    }

    @Test
    @DisplayName("Overall should be the weighted sum rounded to two decimals")
    void testOverall_ShouldBeWeightedSum() {
        // Given: everything 5 except structure (weight 0.12) at 10
        QualityVector vector = QualityVector.uniform(5.0).withScore(QualityDimension.STRUCTURE, 10.0);

        // Then: 5.0 + 5 * 0.12
        assertEquals(5.6, vector.getOverall(), 1e-9);
    }

    @Test
    @DisplayName("Should reject scores outside [0, 10] instead of clamping")
    void testConstruction_ShouldRejectOutOfRange() {
        QualityVector base = QualityVector.uniform(5.0);

        assertThrows(IllegalArgumentException.class, () -> base.withScore(QualityDimension.PACING_QUALITY, 10.01));
        assertThrows(IllegalArgumentException.class, () -> base.withScore(QualityDimension.PACING_QUALITY, -0.5));
        assertThrows(IllegalArgumentException.class, () -> base.withScore(QualityDimension.PACING_QUALITY, Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> base.withScore(QualityDimension.PACING_QUALITY, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Should reject a vector with a missing dimension")
    void testConstruction_ShouldRejectMissingDimension() {
        Map<QualityDimension, Double> scores = new EnumMap<>(QualityVector.uniform(6.0).getScores());
        scores.remove(QualityDimension.ORIGINALITY_SCORE);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> QualityVector.of(scores));
        assertTrue(e.getMessage().contains("originality_score"));
    }

    @Test
    @DisplayName("Weakest dimensions should be strictly below threshold, weakest first")
    void testWeakestDimensions_ShouldSortAscending() {
        // Given
        QualityVector vector = QualityVector.uniform(8.0)
                .withScore(QualityDimension.DIALOGUE_QUALITY, 6.5)
                .withScore(QualityDimension.STRUCTURE, 5.0)
                .withScore(QualityDimension.PACING_QUALITY, 7.0);

        // When
        List<QualityDimension> weak = vector.weakestDimensions(7.0);

        // Then: pacing at exactly 7.0 is not weak
        assertEquals(List.of(QualityDimension.STRUCTURE, QualityDimension.DIALOGUE_QUALITY), weak);
        assertTrue(QualityVector.uniform(9.0).weakestDimensions(7.0).isEmpty());
    }

    @Test
    @DisplayName("Improvement potential should be clamped at zero")
    void testImprovementPotential_ShouldClampAtZero() {
        QualityVector vector = QualityVector.uniform(9.0).withScore(QualityDimension.COHERENCE, 6.0);

        Map<QualityDimension, Double> potential = vector.improvementPotential(8.0);

        assertEquals(2.0, potential.get(QualityDimension.COHERENCE), 1e-9);
        assertEquals(0.0, potential.get(QualityDimension.STRUCTURE), 1e-9);
        assertEquals(QualityDimension.values().length, potential.size());
    }

    @Test
    @DisplayName("Delta should be computed per dimension")
    void testDeltaFrom_ShouldSubtractPerDimension() {
        QualityVector before = QualityVector.uniform(6.0);
        QualityVector after = before.withScore(QualityDimension.SETTING_IMMERSION, 7.5);

        Map<QualityDimension, Double> delta = after.deltaFrom(before);

        assertEquals(1.5, delta.get(QualityDimension.SETTING_IMMERSION), 1e-9);
        assertEquals(0.0, delta.get(QualityDimension.STRUCTURE), 1e-9);
    }

    @Test
    @DisplayName("Every score and the overall should stay within [0, 10] for random input")
    void testRandomVectors_ShouldStayInBounds() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            // Given: random in-range scores, with the bounds themselves sampled often
            Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
            for (QualityDimension dimension : QualityDimension.values()) {
                int pick = random.nextInt(10);
                double score = pick == 0 ? 0.0 : pick == 1 ? 10.0 : random.nextDouble() * 10.0;
                scores.put(dimension, score);
            }

            // When
            QualityVector vector = QualityVector.of(scores);

            // Then
            assertTrue(vector.getOverall() >= 0.0 && vector.getOverall() <= 10.0, "overall " + vector.getOverall());
            vector.getScores().values().forEach(s -> assertTrue(s >= 0.0 && s <= 10.0));
        }
    }

    @Test
    @DisplayName("Random out-of-range input should always be rejected")
    void testRandomOutOfRange_ShouldAlwaysThrow() {
        Random random = new Random(7);
        QualityVector base = QualityVector.uniform(5.0);
        for (int i = 0; i < 1_000; i++) {
            double bad = random.nextBoolean() ? 10.0 + 1e-6 + random.nextDouble() * 100 : -1e-6 - random.nextDouble() * 100;
            QualityDimension dimension = QualityDimension.values()[random.nextInt(QualityDimension.values().length)];
            assertThrows(IllegalArgumentException.class, () -> base.withScore(dimension, bad));
        }
    }
}
