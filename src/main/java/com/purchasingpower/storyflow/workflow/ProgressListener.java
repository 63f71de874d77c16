package com.purchasingpower.storyflow.workflow;

/**
 * Synchronous observer of run progress, called on every step transition.
 *
 * <p>Called on the runner thread, so implementations must return quickly. Exceptions are logged
 * and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = snapshot -> { };

    void onProgress(WorkflowRunSnapshot snapshot);
}
