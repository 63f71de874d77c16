package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One generation strategy as scored by the strategy selector.
 */
@Value
@Builder
public class StrategyCandidate {

    GenerationStrategy strategy;

    /**
     * Raw affinity score used for ranking. Not bounded.
     */
    double score;

    /**
     * Score clamped into the strategy's confidence range.
     */
    double confidence;

    String reasoning;

    Duration estimatedTime;

    double estimatedQuality;

    /**
     * Historical adjustment already included in {@link #score}.
     */
    double historicalBonus;
}
