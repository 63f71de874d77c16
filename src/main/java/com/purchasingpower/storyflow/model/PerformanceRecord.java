package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a finished run, fed back into strategy selection.
 */
@Value
@Builder
public class PerformanceRecord {

    GenerationStrategy strategy;

    StoryGenre genre;

    int targetWordCount;

    boolean success;

    /**
     * Final overall quality; 0 for failed runs.
     */
    double finalQuality;

    Duration duration;

    @Builder.Default
    Instant recordedAt = Instant.now();
}
