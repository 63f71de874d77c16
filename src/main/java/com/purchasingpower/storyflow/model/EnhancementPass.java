package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Record of one executed refinement iteration.
 */
@Value
@Builder
public class EnhancementPass {

    int passNumber;

    EnhancementStrategy strategy;

    Set<QualityDimension> focusDimensions;

    QualityVector before;

    QualityVector after;

    Duration elapsed;

    /**
     * Estimated tokens consumed by the generation call.
     */
    long tokensUsed;

    /**
     * {@code after.overall - before.overall}; negative when the pass made things worse.
     */
    public double getDelta() {
        return after.getOverall() - before.getOverall();
    }

    public Map<QualityDimension, Double> getDimensionDeltas() {
        return after.deltaFrom(before);
    }

    public boolean isImprovement() {
        return getDelta() > 0;
    }
}
