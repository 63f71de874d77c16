package com.purchasingpower.storyflow.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The run's total wall-clock budget elapsed. {@code stepName} is the step that was executing
 * or waiting to retry at that moment.
 */
@Getter
public class WorkflowTimeBudgetExceededException extends StoryFlowException {

    private final String runId;
    private final String stepName;
    private final Duration budget;
    private final Duration elapsed;

    public WorkflowTimeBudgetExceededException(String runId, String stepName, Duration budget, Duration elapsed) {
        super(String.format("Workflow %s exceeded its time budget of %ss during step '%s' (elapsed %ss)",
                runId, budget.toSeconds(), stepName, elapsed.toMillis() / 1000.0), false);
        this.runId = runId;
        this.stepName = stepName;
        this.budget = budget;
        this.elapsed = elapsed;
    }
}
