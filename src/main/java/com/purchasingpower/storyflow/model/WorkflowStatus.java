package com.purchasingpower.storyflow.model;

/**
 * Lifecycle of a submitted story run as seen from outside the runner.
 *
 * <p>State Transitions:
 * <pre>
 * PENDING → RUNNING → COMPLETED
 *             ↓
 *           FAILED
 * </pre>
 * There is no pause or resume: a failed run is discarded.
 */
public enum WorkflowStatus {

    /**
     * Submitted but not yet picked up by the executor.
     */
    PENDING,

    /**
     * Steps are executing.
     */
    RUNNING,

    /**
     * All steps succeeded and a result was assembled.
     */
    COMPLETED,

    /**
     * The run aborted. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
