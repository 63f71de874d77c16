package com.purchasingpower.storyflow.model.dto;

import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.StrategyStatistics;
import com.purchasingpower.storyflow.workflow.StepPerformanceTracker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Strategy history and step timings, for monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsResponse {
    private Map<GenerationStrategy, StrategyStatistics> strategies;
    private Map<String, StepPerformanceTracker.StepStatistics> steps;
    private int activeRuns;
    private int activeStreams;
}
