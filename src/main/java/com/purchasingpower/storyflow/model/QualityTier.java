package com.purchasingpower.storyflow.model;

/**
 * Coarse rating derived from the overall score.
 */
public enum QualityTier {
    EXCELLENT,
    GOOD,
    ACCEPTABLE,
    NEEDS_WORK;

    public static QualityTier fromScore(double overall) {
        if (overall >= 9.0) {
            return EXCELLENT;
        }
        if (overall >= 8.0) {
            return GOOD;
        }
        return overall >= 7.0 ? ACCEPTABLE : NEEDS_WORK;
    }
}
