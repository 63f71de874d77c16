package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fully assembled result of a successful run.
 */
@Value
@Builder
public class StoryResult {

    String runId;

    String title;

    String content;

    int wordCount;

    StoryRequirements requirements;

    GenerationStrategy strategy;

    StrategyRecommendation recommendation;

    RequirementAnalysis analysis;

    String outline;

    QualityVector initialQuality;

    QualityVector finalQuality;

    /**
     * Null when enhancement was disabled or skipped.
     */
    EnhancementResult enhancement;

    List<String> completedSteps;

    List<String> failedSteps;

    List<StepTiming> stepTimings;

    Instant startedAt;

    Duration totalDuration;
}
