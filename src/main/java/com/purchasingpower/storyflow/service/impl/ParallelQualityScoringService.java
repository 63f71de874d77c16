package com.purchasingpower.storyflow.service.impl;

import com.purchasingpower.storyflow.exception.QualityAssessmentException;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.service.DimensionScorer;
import com.purchasingpower.storyflow.service.QualityScoringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * Scores all dimensions concurrently, one {@link DimensionScorer} call each, and combines them
 * into a {@link QualityVector}.
 *
 * <p>Fail-fast: the first dimension that fails cancels the others and fails the whole call.
 * Interrupting the calling thread (step timeout, run budget) cancels all in-flight scoring.
 */
@Slf4j
@Service
public class ParallelQualityScoringService implements QualityScoringService {

    private final DimensionScorer scorer;
    private final Executor executor;

    public ParallelQualityScoringService(DimensionScorer scorer,
                                         @Qualifier("assessmentExecutor") Executor executor) {
        this.scorer = scorer;
        this.executor = executor;
    }

    @Override
    public QualityVector score(String content, StoryRequirements requirements) {
        CompletionService<Map.Entry<QualityDimension, Double>> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Map.Entry<QualityDimension, Double>>, QualityDimension> pending = new HashMap<>();

        for (QualityDimension dimension : QualityDimension.values()) {
            pending.put(completion.submit(() ->
                    Map.entry(dimension, scorer.score(dimension, content, requirements))), dimension);
        }

        Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        try {
            while (scores.size() < QualityDimension.values().length) {
                Future<Map.Entry<QualityDimension, Double>> done = completion.take();
                QualityDimension dimension = pending.remove(done);
                try {
                    Map.Entry<QualityDimension, Double> entry = done.get();
                    scores.put(entry.getKey(), entry.getValue());
                } catch (ExecutionException e) {
                    cancelAll(pending.keySet());
                    throw toAssessmentFailure(dimension, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancelAll(pending.keySet());
            Thread.currentThread().interrupt();
            throw new QualityAssessmentException("Quality assessment interrupted", e);
        }

        return QualityVector.of(scores);
    }

    private static void cancelAll(Iterable<Future<Map.Entry<QualityDimension, Double>>> futures) {
        List<Future<?>> cancelled = new ArrayList<>();
        for (Future<?> future : futures) {
            if (future.cancel(true)) {
                cancelled.add(future);
            }
        }
        if (!cancelled.isEmpty()) {
            log.debug("Cancelled {} in-flight dimension assessments", cancelled.size());
        }
    }

    private static QualityAssessmentException toAssessmentFailure(QualityDimension dimension, Throwable cause) {
        if (cause instanceof QualityAssessmentException qae) {
            return qae;
        }
        log.warn("⚠️ Assessment of {} failed: {}", dimension.key(), cause.getMessage());
        return new QualityAssessmentException("Assessment of " + dimension.key() + " failed: " + cause.getMessage(),
                dimension, cause);
    }
}
