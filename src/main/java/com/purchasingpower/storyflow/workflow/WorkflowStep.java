package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.model.WorkflowStage;

/**
 * One stage of the story pipeline.
 *
 * <p>The runner calls {@link #execute} on a step thread, possibly several times when the step
 * is retried, and possibly abandoning an attempt that timed out. {@code execute} must therefore
 * only read the context. The result of the successful attempt is handed to
 * {@link #applyResult} on the runner thread, which is the only place the context is written.
 *
 * @param <T> what the step produces
 */
public interface WorkflowStep<T> {

    /**
     * Unique step name, also the key for per-step configuration.
     */
    String name();

    WorkflowStage stage();

    T execute(WorkflowContext context);

    void applyResult(WorkflowContext context, T result);

    /**
     * Called on the runner thread when an optional step has run out of attempts and the run
     * continues without it. Lets a step keep whatever partial result its last failure carries.
     *
     * @param error cause of the last failed attempt; null when it timed out
     */
    default void applyFailure(WorkflowContext context, Throwable error) {
    }
}
