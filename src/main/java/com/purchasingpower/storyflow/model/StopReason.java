package com.purchasingpower.storyflow.model;

/**
 * Why the enhancement loop stopped.
 */
public enum StopReason {
    TARGET_ACHIEVED,
    PASS_BUDGET_EXHAUSTED,
    CONVERGED,

    /**
     * A pass failed; only set on the best-known result attached to the failure.
     */
    PASS_FAILED
}
