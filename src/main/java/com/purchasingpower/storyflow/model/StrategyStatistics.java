package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated history for one generation strategy.
 */
@Value
@Builder
public class StrategyStatistics {

    GenerationStrategy strategy;

    int totalRuns;

    int successfulRuns;

    double successRate;

    double averageQuality;

    double averageDurationSeconds;
}
