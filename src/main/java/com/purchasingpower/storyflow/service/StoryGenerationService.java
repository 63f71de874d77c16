package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.dto.StatisticsResponse;
import com.purchasingpower.storyflow.model.dto.StoryRunResponse;

import java.util.Optional;

/**
 * Asynchronous front door to the story workflow.
 */
public interface StoryGenerationService {

    /**
     * Submit a run and return its id immediately.
     *
     * @param requestedStrategy strategy to force, or null to let the selector decide
     */
    String submit(StoryRequirements requirements, GenerationStrategy requestedStrategy);

    /**
     * Current status of a run, or empty if the id is unknown or has been evicted.
     */
    Optional<StoryRunResponse> getRun(String runId);

    StatisticsResponse statistics();
}
