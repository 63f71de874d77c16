package com.purchasingpower.storyflow.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Refinement instruction categories. Each focused strategy targets one quality dimension;
 * {@link #COMPREHENSIVE} is used when no dimension is weak.
 */
public enum EnhancementStrategy {

    STRUCTURE_FOCUS(QualityDimension.STRUCTURE),
    CHARACTER_FOCUS(QualityDimension.CHARACTER_DEVELOPMENT),
    PACING_FOCUS(QualityDimension.PACING_QUALITY),
    COHERENCE_FOCUS(QualityDimension.COHERENCE),
    GENRE_FOCUS(QualityDimension.GENRE_COMPLIANCE),
    DIALOGUE_FOCUS(QualityDimension.DIALOGUE_QUALITY),
    SETTING_FOCUS(QualityDimension.SETTING_IMMERSION),
    EMOTIONAL_FOCUS(QualityDimension.EMOTIONAL_IMPACT),
    TECHNICAL_FOCUS(QualityDimension.TECHNICAL_QUALITY),
    COMPREHENSIVE(null);

    private final QualityDimension target;

    EnhancementStrategy(QualityDimension target) {
        this.target = target;
    }

    /**
     * The dimension this strategy is aimed at; empty for {@link #COMPREHENSIVE}.
     */
    public Optional<QualityDimension> getTarget() {
        return Optional.ofNullable(target);
    }

    /**
     * Dimensions a pass using this strategy is expected to move.
     */
    public Set<QualityDimension> focusDimensions() {
        if (target == null) {
            return EnumSet.of(QualityDimension.STRUCTURE, QualityDimension.CHARACTER_DEVELOPMENT,
                    QualityDimension.COHERENCE, QualityDimension.PACING_QUALITY);
        }
        return EnumSet.of(target);
    }

    /**
     * Strategy aimed at the given dimension, if one exists. Theme integration and originality
     * have no dedicated strategy.
     */
    public static Optional<EnhancementStrategy> forDimension(QualityDimension dimension) {
        for (EnhancementStrategy strategy : values()) {
            if (strategy.target == dimension) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    /**
     * Template key for the refinement instruction, e.g. "structure-focus".
     */
    public String templateKey() {
        return name().toLowerCase(java.util.Locale.ROOT).replace('_', '-');
    }
}
