package com.purchasingpower.storyflow.workflow.enhancement;

import com.purchasingpower.storyflow.config.EnhancementConfig;
import com.purchasingpower.storyflow.model.EnhancementStrategy;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Chooses what the next enhancement pass should work on.
 *
 * <p>Every dimension below the weak-dimension threshold that has a dedicated strategy gets a
 * priority of {@code (10 - score) * weight}. The highest priority wins; equal priorities are
 * resolved by {@link #TIE_BREAK_ORDER}. With no weak dimension the pass is
 * {@link EnhancementStrategy#COMPREHENSIVE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnhancementStrategySelector {

    /**
     * Earlier entries win ties. Theme integration and originality have no strategy of their own.
     */
    static final List<QualityDimension> TIE_BREAK_ORDER = List.of(
            QualityDimension.STRUCTURE,
            QualityDimension.COHERENCE,
            QualityDimension.CHARACTER_DEVELOPMENT,
            QualityDimension.PACING_QUALITY,
            QualityDimension.GENRE_COMPLIANCE,
            QualityDimension.DIALOGUE_QUALITY,
            QualityDimension.SETTING_IMMERSION,
            QualityDimension.EMOTIONAL_IMPACT,
            QualityDimension.TECHNICAL_QUALITY);

    private final EnhancementConfig config;

    public EnhancementStrategy select(QualityVector quality) {
        EnhancementStrategy strategy = selectTarget(quality)
                .flatMap(EnhancementStrategy::forDimension)
                .orElse(EnhancementStrategy.COMPREHENSIVE);
        log.debug("Selected enhancement strategy {} for overall {}", strategy, quality.getOverall());
        return strategy;
    }

    /**
     * Highest-priority weak dimension, or empty when none qualifies.
     */
    public Optional<QualityDimension> selectTarget(QualityVector quality) {
        QualityDimension best = null;
        double bestPriority = Double.NEGATIVE_INFINITY;

        for (QualityDimension dimension : TIE_BREAK_ORDER) {
            double score = quality.score(dimension);
            if (score >= config.getWeakDimensionThreshold()) {
                continue;
            }
            double priority = priority(dimension, score);
            if (priority > bestPriority) {
                best = dimension;
                bestPriority = priority;
            }
        }
        return Optional.ofNullable(best);
    }

    double priority(QualityDimension dimension, double score) {
        return (QualityVector.MAX_SCORE - score) * config.weightFor(dimension);
    }
}
