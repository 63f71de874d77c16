package com.purchasingpower.storyflow.workflow;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling window of step durations across runs, for monitoring.
 */
public class StepPerformanceTracker {

    static final int WINDOW = 100;

    private final Map<String, Deque<Duration>> durations = new ConcurrentHashMap<>();

    public void record(String stepName, Duration elapsed) {
        Deque<Duration> window = durations.computeIfAbsent(stepName, k -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(elapsed);
            if (window.size() > WINDOW) {
                window.removeFirst();
            }
        }
    }

    public Map<String, StepStatistics> statistics() {
        Map<String, StepStatistics> stats = new LinkedHashMap<>();
        durations.forEach((step, window) -> {
            synchronized (window) {
                if (window.isEmpty()) {
                    return;
                }
                long total = 0;
                long min = Long.MAX_VALUE;
                long max = 0;
                for (Duration d : window) {
                    long ms = d.toMillis();
                    total += ms;
                    min = Math.min(min, ms);
                    max = Math.max(max, ms);
                }
                stats.put(step, StepStatistics.builder()
                        .count(window.size())
                        .averageMs(total / (double) window.size())
                        .minMs(min)
                        .maxMs(max)
                        .build());
            }
        });
        return stats;
    }

    @Value
    @Builder
    public static class StepStatistics {
        int count;
        double averageMs;
        long minMs;
        long maxMs;
    }
}
