package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a {@link WorkflowRun} at one moment, handed to progress listeners and the
 * REST layer.
 */
@Value
@Builder
public class WorkflowRunSnapshot {

    String runId;
    WorkflowStatus status;
    WorkflowStage stage;

    /**
     * Step executing at the time of the snapshot; null between steps.
     */
    String currentStep;

    double progress;
    List<String> completedSteps;
    List<String> remainingSteps;
    List<String> failedSteps;
    int errorCount;
    String lastError;
    Instant startedAt;
    Duration elapsed;
    Map<WorkflowStage, Duration> stageElapsed;
}
