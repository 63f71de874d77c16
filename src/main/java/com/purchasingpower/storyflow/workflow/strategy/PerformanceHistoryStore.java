package com.purchasingpower.storyflow.workflow.strategy;

import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.PerformanceRecord;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StrategyStatistics;

import java.util.Map;

/**
 * Outcomes of finished runs, shared by all runs in the process.
 *
 * <p>Implementations must allow concurrent reads while a run scores strategies and a
 * concurrent write when another run finishes.
 */
public interface PerformanceHistoryStore {

    void recordOutcome(PerformanceRecord record);

    /**
     * Score adjustment for {@code strategy} based on past runs similar to {@code requirements}.
     * Zero when there is no comparable history.
     */
    double queryBonus(GenerationStrategy strategy, StoryRequirements requirements);

    Map<GenerationStrategy, StrategyStatistics> statistics();
}
