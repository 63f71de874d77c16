package com.purchasingpower.storyflow.workflow.strategy;

import com.purchasingpower.storyflow.config.StrategyConfig;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.PerformanceRecord;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StrategyStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link PerformanceHistoryStore} holding the most recent outcomes per strategy in memory,
 * guarded by a read/write lock. Nothing survives a restart.
 *
 * <p>Bonus for similar past runs (same genre, word count within the configured tolerance):
 * <pre>
 *   (successRate - 0.8) * 0.2 + (avgQualityOfSuccesses - 7.0) * 0.05, clamped to [-0.1, 0.2]
 * </pre>
 */
@Slf4j
@Component
public class InMemoryPerformanceHistoryStore implements PerformanceHistoryStore {

    static final double MIN_BONUS = -0.1;
    static final double MAX_BONUS = 0.2;

    private final StrategyConfig config;
    private final Map<GenerationStrategy, Deque<PerformanceRecord>> records = new EnumMap<>(GenerationStrategy.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryPerformanceHistoryStore(StrategyConfig config) {
        this.config = config;
        for (GenerationStrategy strategy : GenerationStrategy.values()) {
            records.put(strategy, new ArrayDeque<>());
        }
    }

    @Override
    public void recordOutcome(PerformanceRecord record) {
        lock.writeLock().lock();
        try {
            Deque<PerformanceRecord> window = records.get(record.getStrategy());
            window.addLast(record);
            while (window.size() > config.getHistoryWindow()) {
                window.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Recorded {} outcome: success={}, quality={}",
                record.getStrategy(), record.isSuccess(), record.getFinalQuality());
    }

    @Override
    public double queryBonus(GenerationStrategy strategy, StoryRequirements requirements) {
        if (!config.isEnableStrategyLearning()) {
            return 0.0;
        }

        List<PerformanceRecord> similar = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (PerformanceRecord record : records.get(strategy)) {
                if (isSimilar(record, requirements)) {
                    similar.add(record);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (similar.isEmpty()) {
            return 0.0;
        }

        int successes = 0;
        double qualitySum = 0.0;
        for (PerformanceRecord record : similar) {
            if (record.isSuccess()) {
                successes++;
                qualitySum += record.getFinalQuality();
            }
        }
        double successRate = (double) successes / similar.size();
        double averageQuality = qualitySum / Math.max(1, successes);

        double bonus = (successRate - 0.8) * 0.2 + (averageQuality - 7.0) * 0.05;
        return Math.max(MIN_BONUS, Math.min(MAX_BONUS, bonus));
    }

    @Override
    public Map<GenerationStrategy, StrategyStatistics> statistics() {
        Map<GenerationStrategy, StrategyStatistics> stats = new EnumMap<>(GenerationStrategy.class);
        lock.readLock().lock();
        try {
            records.forEach((strategy, window) -> stats.put(strategy, summarize(strategy, window)));
        } finally {
            lock.readLock().unlock();
        }
        return stats;
    }

    private boolean isSimilar(PerformanceRecord record, StoryRequirements requirements) {
        int target = requirements.getTargetWordCount();
        return record.getGenre() == requirements.getGenre()
                && Math.abs(record.getTargetWordCount() - target) < target * config.getSimilarWordCountTolerance();
    }

    private static StrategyStatistics summarize(GenerationStrategy strategy, Deque<PerformanceRecord> window) {
        int total = window.size();
        int successes = 0;
        double qualitySum = 0.0;
        double secondsSum = 0.0;
        for (PerformanceRecord record : window) {
            if (record.isSuccess()) {
                successes++;
                qualitySum += record.getFinalQuality();
            }
            if (record.getDuration() != null) {
                secondsSum += record.getDuration().toMillis() / 1000.0;
            }
        }
        return StrategyStatistics.builder()
                .strategy(strategy)
                .totalRuns(total)
                .successfulRuns(successes)
                .successRate(total == 0 ? 0.0 : (double) successes / total)
                .averageQuality(successes == 0 ? 0.0 : qualitySum / successes)
                .averageDurationSeconds(total == 0 ? 0.0 : secondsSum / total)
                .build();
    }
}
