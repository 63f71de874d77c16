package com.purchasingpower.storyflow.workflow.enhancement;

import com.purchasingpower.storyflow.model.ConvergenceState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Watches per-pass quality deltas and decides when further passes are not worth it.
 *
 * <ul>
 *   <li><b>Plateau</b>: the two most recent deltas are both below the convergence threshold.
 *   <li><b>Diminishing returns</b>: the latest delta is less than half of the previous one.
 * </ul>
 * Either signal stops the loop. The tracker only ever shortens a loop, it never extends one.
 *
 * <p>One tracker per enhancement run; not thread-safe.
 */
public class ConvergenceTracker {

    private static final double DIMINISHING_RATIO = 0.5;
    private static final int MAX_PREDICTION_HORIZON = 20;

    private final double threshold;
    private final List<Double> deltas = new ArrayList<>();
    private ConvergenceState state = ConvergenceState.INITIAL;

    public ConvergenceTracker(double threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Convergence threshold must be >= 0, got " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Record the overall delta of the pass just executed and return the updated state.
     */
    public ConvergenceState record(double delta) {
        deltas.add(delta);

        boolean plateau = false;
        boolean diminishing = false;
        if (deltas.size() >= 2) {
            double latest = deltas.get(deltas.size() - 1);
            double previous = deltas.get(deltas.size() - 2);
            plateau = latest < threshold && previous < threshold;
            diminishing = latest < DIMINISHING_RATIO * previous;
        }

        state = ConvergenceState.builder()
                .deltas(Collections.unmodifiableList(new ArrayList<>(deltas)))
                .plateauDetected(plateau)
                .diminishingReturnsDetected(diminishing)
                .predictedConvergencePass(predictConvergencePass())
                .build();
        return state;
    }

    public ConvergenceState state() {
        return state;
    }

    /**
     * Extrapolate the last two positive deltas geometrically and return the pass number at which
     * the gain is expected to drop below the threshold. Null when the trend is not shrinking.
     */
    private Integer predictConvergencePass() {
        int passes = deltas.size();
        double latest = deltas.get(passes - 1);
        if (latest < threshold) {
            return passes;
        }
        if (passes < 2) {
            return null;
        }
        double previous = deltas.get(passes - 2);
        if (previous <= 0 || latest <= 0 || latest >= previous) {
            return null;
        }
        double ratio = latest / previous;
        double projected = latest;
        for (int extra = 1; extra <= MAX_PREDICTION_HORIZON; extra++) {
            projected *= ratio;
            if (projected < threshold) {
                return passes + extra;
            }
        }
        return null;
    }
}
