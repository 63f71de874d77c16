package com.purchasingpower.storyflow.service.impl;

import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.PerformanceRecord;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StoryResult;
import com.purchasingpower.storyflow.model.dto.StatisticsResponse;
import com.purchasingpower.storyflow.model.dto.StoryRunResponse;
import com.purchasingpower.storyflow.model.dto.WorkflowEvent;
import com.purchasingpower.storyflow.service.StoryGenerationService;
import com.purchasingpower.storyflow.service.WorkflowStreamService;
import com.purchasingpower.storyflow.workflow.WorkflowRunner;
import com.purchasingpower.storyflow.workflow.strategy.PerformanceHistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Submits runs to the workflow executor and keeps finished results in memory.
 *
 * <p>Each submitted run is one task on {@code workflowExecutor}; the controller returns as soon
 * as the task is queued. Progress is pushed to {@link WorkflowStreamService}. When a run ends its
 * outcome is recorded in the {@link PerformanceHistoryStore}. Only the most recent
 * {@link #MAX_FINISHED_RUNS} finished runs are kept.
 */
@Slf4j
@Service
public class StoryGenerationServiceImpl implements StoryGenerationService {

    static final int MAX_FINISHED_RUNS = 500;

    private final WorkflowRunner workflowRunner;
    private final PerformanceHistoryStore historyStore;
    private final WorkflowStreamService streamService;
    private final Executor workflowExecutor;

    private final Map<String, StoryRunResponse> runs = new ConcurrentHashMap<>();
    private final Deque<String> finishedOrder = new ArrayDeque<>();

    public StoryGenerationServiceImpl(WorkflowRunner workflowRunner,
                                      PerformanceHistoryStore historyStore,
                                      WorkflowStreamService streamService,
                                      @Qualifier("workflowExecutor") Executor workflowExecutor) {
        this.workflowRunner = workflowRunner;
        this.historyStore = historyStore;
        this.streamService = streamService;
        this.workflowExecutor = workflowExecutor;
    }

    @Override
    public String submit(StoryRequirements requirements, GenerationStrategy requestedStrategy) {
        String runId = UUID.randomUUID().toString();
        runs.put(runId, StoryRunResponse.accepted(runId));

        log.info("🚀 Submitting story run {} ({} words, genre {}, strategy {})", runId,
                requirements.getTargetWordCount(), requirements.getDisplayGenre(),
                requestedStrategy != null ? requestedStrategy : "auto");
        try {
            workflowExecutor.execute(() -> runWorkflow(runId, requirements, requestedStrategy));
        } catch (RejectedExecutionException e) {
            runs.remove(runId);
            throw e;
        }
        return runId;
    }

    @Override
    public Optional<StoryRunResponse> getRun(String runId) {
        StoryRunResponse stored = runs.get(runId);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.getStatus() != null && stored.getStatus().isTerminal()) {
            return Optional.of(stored);
        }
        return Optional.of(workflowRunner.activeRun(runId)
                .map(StoryRunResponse::fromSnapshot)
                .orElse(stored));
    }

    @Override
    public StatisticsResponse statistics() {
        return StatisticsResponse.builder()
                .strategies(historyStore.statistics())
                .steps(workflowRunner.stepStatistics())
                .activeRuns(workflowRunner.activeRuns().size())
                .activeStreams(streamService.getActiveStreamCount())
                .build();
    }

    void runWorkflow(String runId, StoryRequirements requirements, GenerationStrategy requestedStrategy) {
        Instant start = Instant.now();
        try {
            StoryResult result = workflowRunner.execute(runId, requirements, requestedStrategy,
                    snapshot -> streamService.sendUpdate(runId, WorkflowEvent.fromSnapshot(snapshot)));

            historyStore.recordOutcome(PerformanceRecord.builder()
                    .strategy(result.getStrategy())
                    .genre(requirements.getGenre())
                    .targetWordCount(requirements.getTargetWordCount())
                    .success(true)
                    .finalQuality(result.getFinalQuality() != null ? result.getFinalQuality().getOverall() : 0.0)
                    .duration(result.getTotalDuration())
                    .build());

            finish(runId, StoryRunResponse.completed(result));
            streamService.complete(runId, "✅ \"" + result.getTitle() + "\" completed",
                    result.getFinalQuality());

        } catch (RuntimeException e) {
            log.error("❌ Story run {} failed: {}", runId, e.getMessage());

            // An aborted run exposes no context, so only a caller-forced strategy can be charged.
            if (requestedStrategy != null) {
                historyStore.recordOutcome(PerformanceRecord.builder()
                        .strategy(requestedStrategy)
                        .genre(requirements.getGenre())
                        .targetWordCount(requirements.getTargetWordCount())
                        .success(false)
                        .finalQuality(0.0)
                        .duration(Duration.between(start, Instant.now()))
                        .build());
            }

            finish(runId, StoryRunResponse.failed(runId, e.getMessage()));
            streamService.fail(runId, e.getMessage());
        }
    }

    private void finish(String runId, StoryRunResponse response) {
        runs.put(runId, response);
        String evicted = null;
        synchronized (finishedOrder) {
            finishedOrder.addLast(runId);
            if (finishedOrder.size() > MAX_FINISHED_RUNS) {
                evicted = finishedOrder.removeFirst();
            }
        }
        if (evicted != null) {
            runs.remove(evicted);
            streamService.discard(evicted);
            log.debug("Evicted finished run {}", evicted);
        }
    }
}
