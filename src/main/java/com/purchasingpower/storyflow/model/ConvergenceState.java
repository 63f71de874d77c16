package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the convergence tracker after a pass.
 */
@Value
@Builder(toBuilder = true)
public class ConvergenceState {

    public static final ConvergenceState INITIAL = ConvergenceState.builder()
            .deltas(List.of())
            .build();

    /**
     * Per-pass overall deltas, oldest first.
     */
    List<Double> deltas;

    boolean plateauDetected;

    boolean diminishingReturnsDetected;

    /**
     * Pass at which gains are expected to fall below the convergence threshold, if the trend
     * is shrinking geometrically.
     */
    Integer predictedConvergencePass;

    public boolean isConverged() {
        return plateauDetected || diminishingReturnsDetected;
    }

    public Optional<Integer> predictedConvergencePass() {
        return Optional.ofNullable(predictedConvergencePass);
    }
}
