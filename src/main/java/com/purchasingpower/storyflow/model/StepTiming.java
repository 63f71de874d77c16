package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Execution statistics for one step of one run.
 */
@Value
@Builder
public class StepTiming {

    String stepName;

    WorkflowStage stage;

    int attempts;

    int retries;

    /**
     * Backoff delay applied before each retry, in order.
     */
    List<Duration> backoffs;

    Duration elapsed;

    boolean succeeded;

    boolean required;

    /**
     * Last error message when the step failed.
     */
    String error;
}
