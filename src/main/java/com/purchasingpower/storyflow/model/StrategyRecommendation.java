package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Ranked result of strategy selection. Produced once per run and never modified.
 */
@Value
@Builder
public class StrategyRecommendation {

    StrategyCandidate selected;

    /**
     * The next best candidates, best first. At most two.
     */
    @Singular
    List<StrategyCandidate> alternatives;

    double complexity;

    Duration selectionTime;

    public GenerationStrategy getStrategy() {
        return selected.getStrategy();
    }

    public double getConfidence() {
        return selected.getConfidence();
    }

    public String getReasoning() {
        return selected.getReasoning();
    }
}
