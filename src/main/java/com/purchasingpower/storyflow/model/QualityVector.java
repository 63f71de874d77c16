package com.purchasingpower.storyflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a story's quality: one score per {@link QualityDimension} plus the
 * weighted overall score.
 *
 * <p>Every score lies in [0, 10]. Construction rejects missing dimensions and out-of-range or
 * non-finite values with {@link IllegalArgumentException}; nothing is clamped. The overall score
 * is the weighted sum of all dimensions (weights sum to 1.0) rounded to two decimals.
 */
public final class QualityVector {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    private final Map<QualityDimension, Double> scores;
    private final double overall;
    private final Duration assessmentDuration;

    private QualityVector(Map<QualityDimension, Double> scores, Duration assessmentDuration) {
        EnumMap<QualityDimension, Double> copy = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            Double score = scores.get(dimension);
            if (score == null) {
                throw new IllegalArgumentException("Missing score for dimension: " + dimension.key());
            }
            copy.put(dimension, requireInRange(dimension.key(), score));
        }
        this.scores = Collections.unmodifiableMap(copy);
        this.overall = computeOverall(copy);
        this.assessmentDuration = assessmentDuration == null ? Duration.ZERO : assessmentDuration;
    }

    public static QualityVector of(Map<QualityDimension, Double> scores) {
        return new QualityVector(Objects.requireNonNull(scores, "scores"), Duration.ZERO);
    }

    public static QualityVector of(Map<QualityDimension, Double> scores, Duration assessmentDuration) {
        return new QualityVector(Objects.requireNonNull(scores, "scores"), assessmentDuration);
    }

    /**
     * Vector with the same score on every dimension.
     */
    public static QualityVector uniform(double score) {
        EnumMap<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            scores.put(dimension, score);
        }
        return new QualityVector(scores, Duration.ZERO);
    }

    /**
     * Copy of this vector with one dimension replaced; the overall score is recomputed.
     */
    public QualityVector withScore(QualityDimension dimension, double score) {
        EnumMap<QualityDimension, Double> updated = new EnumMap<>(scores);
        updated.put(dimension, score);
        return new QualityVector(updated, assessmentDuration);
    }

    public QualityVector withAssessmentDuration(Duration duration) {
        return new QualityVector(scores, duration);
    }

    public double getOverall() {
        return overall;
    }

    public Map<QualityDimension, Double> getScores() {
        return scores;
    }

    @JsonIgnore
    public Duration getAssessmentDuration() {
        return assessmentDuration;
    }

    public double score(QualityDimension dimension) {
        return scores.get(dimension);
    }

    /**
     * Dimensions scoring strictly below {@code threshold}, weakest first. Ties keep declaration
     * order.
     */
    public List<QualityDimension> weakestDimensions(double threshold) {
        List<QualityDimension> weak = new ArrayList<>();
        for (Map.Entry<QualityDimension, Double> entry : scores.entrySet()) {
            if (entry.getValue() < threshold) {
                weak.add(entry.getKey());
            }
        }
        weak.sort(Comparator.comparingDouble(scores::get));
        return weak;
    }

    /**
     * Points each dimension still needs to reach {@code targetScore}; 0 for dimensions already
     * at or above it.
     */
    public Map<QualityDimension, Double> improvementPotential(double targetScore) {
        EnumMap<QualityDimension, Double> potential = new EnumMap<>(QualityDimension.class);
        scores.forEach((dimension, score) -> potential.put(dimension, Math.max(0.0, targetScore - score)));
        return potential;
    }

    /**
     * Per-dimension change from {@code before} to this vector.
     */
    public Map<QualityDimension, Double> deltaFrom(QualityVector before) {
        EnumMap<QualityDimension, Double> deltas = new EnumMap<>(QualityDimension.class);
        scores.forEach((dimension, score) -> deltas.put(dimension, score - before.score(dimension)));
        return deltas;
    }

    private static double computeOverall(Map<QualityDimension, Double> scores) {
        double weighted = 0.0;
        for (Map.Entry<QualityDimension, Double> entry : scores.entrySet()) {
            weighted += entry.getValue() * entry.getKey().getOverallWeight();
        }
        double rounded = Math.round(weighted * 100.0) / 100.0;
        return Math.min(MAX_SCORE, Math.max(MIN_SCORE, rounded));
    }

    private static double requireInRange(String name, double score) {
        if (!Double.isFinite(score) || score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException(
                    "Score for " + name + " must be within [0, 10] but was " + score);
        }
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualityVector that)) return false;
        return scores.equals(that.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "QualityVector{overall=" + overall + ", scores=" + scores + '}';
    }
}
