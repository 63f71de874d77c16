package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live state of one run. Mutated only by {@link WorkflowRunner}; read by others through
 * {@link #snapshot()}.
 *
 * <p>Every registered step name is in exactly one of remaining, current, completed or failed.
 * Progress never decreases.
 */
class WorkflowRun {

    private final String runId;
    private final Instant startedAt;
    private final Set<String> remaining;
    private final List<String> completed = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private final Map<WorkflowStage, Duration> stageElapsed = new EnumMap<>(WorkflowStage.class);

    private WorkflowStatus status = WorkflowStatus.RUNNING;
    private WorkflowStage stage;
    private String currentStep;
    private Instant currentStepStart;
    private double progress;
    private int errorCount;
    private String lastError;

    WorkflowRun(String runId, List<String> stepNames, WorkflowStage firstStage) {
        this.runId = runId;
        this.startedAt = Instant.now();
        this.remaining = new LinkedHashSet<>(stepNames);
        this.stage = firstStage;
    }

    String getRunId() {
        return runId;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    synchronized void beginStep(String stepName, WorkflowStage stepStage, double stepProgress) {
        if (!remaining.remove(stepName)) {
            throw new IllegalStateException("Step '" + stepName + "' is not pending in run " + runId);
        }
        currentStep = stepName;
        currentStepStart = Instant.now();
        stage = stepStage;
        advanceProgress(stepProgress);
    }

    synchronized void completeStep(String stepName) {
        requireCurrent(stepName);
        completed.add(stepName);
        endCurrent();
    }

    synchronized void failStep(String stepName, String error) {
        requireCurrent(stepName);
        failed.add(stepName);
        errorCount++;
        lastError = error;
        endCurrent();
    }

    synchronized void finish() {
        stage = WorkflowStage.FINALIZATION;
        status = WorkflowStatus.COMPLETED;
        advanceProgress(1.0);
    }

    synchronized void abort(String error) {
        if (currentStep != null) {
            failed.add(currentStep);
            errorCount++;
            endCurrent();
        }
        status = WorkflowStatus.FAILED;
        lastError = error;
    }

    synchronized WorkflowRunSnapshot snapshot() {
        Map<WorkflowStage, Duration> stages = new EnumMap<>(stageElapsed);
        if (currentStep != null) {
            stages.merge(stage, Duration.between(currentStepStart, Instant.now()), Duration::plus);
        }
        return WorkflowRunSnapshot.builder()
                .runId(runId)
                .status(status)
                .stage(stage)
                .currentStep(currentStep)
                .progress(progress)
                .completedSteps(List.copyOf(completed))
                .remainingSteps(List.copyOf(remaining))
                .failedSteps(List.copyOf(failed))
                .errorCount(errorCount)
                .lastError(lastError)
                .startedAt(startedAt)
                .elapsed(Duration.between(startedAt, Instant.now()))
                .stageElapsed(Map.copyOf(stages))
                .build();
    }

    synchronized List<String> completedSteps() {
        return List.copyOf(completed);
    }

    synchronized List<String> failedSteps() {
        return List.copyOf(failed);
    }

    private void advanceProgress(double value) {
        progress = Math.max(progress, Math.min(1.0, value));
    }

    private void requireCurrent(String stepName) {
        if (!stepName.equals(currentStep)) {
            throw new IllegalStateException("Step '" + stepName + "' is not executing in run " + runId);
        }
    }

    private void endCurrent() {
        stageElapsed.merge(stage, Duration.between(currentStepStart, Instant.now()), Duration::plus);
        currentStep = null;
        currentStepStart = null;
    }
}
