package com.purchasingpower.storyflow.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.storyflow.StoryFixtures;
import com.purchasingpower.storyflow.config.GlobalRetryConfig;
import com.purchasingpower.storyflow.config.StrategyConfig;
import com.purchasingpower.storyflow.config.WorkflowConfig;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StrategyStatistics;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import com.purchasingpower.storyflow.model.dto.StoryRunResponse;
import com.purchasingpower.storyflow.model.dto.WorkflowEvent;
import com.purchasingpower.storyflow.service.WorkflowStreamService;
import com.purchasingpower.storyflow.workflow.RetryPolicy;
import com.purchasingpower.storyflow.workflow.StepDefinition;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowRunner;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import com.purchasingpower.storyflow.workflow.strategy.InMemoryPerformanceHistoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Story Generation Service Tests")
class StoryGenerationServiceImplTest {

    private ExecutorService stepExecutor;
    private InMemoryPerformanceHistoryStore history;
    private WorkflowStreamService streams;

    @BeforeEach
    void setUp() {
        stepExecutor = Executors.newCachedThreadPool();
        history = new InMemoryPerformanceHistoryStore(new StrategyConfig());
        streams = new WorkflowStreamService(new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        stepExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Completed run should be stored, streamed and recorded in history")
    void testSubmit_ShouldRecordSuccessfulRun() {
        // Given: the workflow runs on the calling thread
        StoryGenerationServiceImpl service = service(new WritingStep(false), Runnable::run);

        // When
        String runId = service.submit(StoryFixtures.mysteryRequirements(), null);

        // Then
        StoryRunResponse response = service.getRun(runId).orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, response.getStatus());
        assertTrue(response.isSuccess());
        assertEquals("The keeper lied.", response.getResult().getContent());

        StrategyStatistics stats = history.statistics().get(GenerationStrategy.ITERATIVE);
        assertEquals(1, stats.getTotalRuns());
        assertEquals(8.0, stats.getAverageQuality(), 1e-9);

        List<WorkflowEvent> events = streams.bufferedEvents(runId);
        assertEquals(WorkflowStatus.COMPLETED, events.get(events.size() - 1).getStatus());
    }

    @Test
    @DisplayName("Failed run with a forced strategy should be charged to that strategy")
    void testSubmit_ShouldRecordFailureForForcedStrategy() {
        StoryGenerationServiceImpl service = service(new WritingStep(true), Runnable::run);

        String runId = service.submit(StoryFixtures.mysteryRequirements(), GenerationStrategy.OUTLINE);

        StoryRunResponse response = service.getRun(runId).orElseThrow();
        assertEquals(WorkflowStatus.FAILED, response.getStatus());
        assertFalse(response.isSuccess());
        assertTrue(response.getError().contains("content_generation"));

        StrategyStatistics stats = history.statistics().get(GenerationStrategy.OUTLINE);
        assertEquals(1, stats.getTotalRuns());
        assertEquals(0, stats.getSuccessfulRuns());
    }

    @Test
    @DisplayName("Failed run without a forced strategy should leave history untouched")
    void testSubmit_ShouldNotRecordUnattributedFailure() {
        StoryGenerationServiceImpl service = service(new WritingStep(true), Runnable::run);

        service.submit(StoryFixtures.mysteryRequirements(), null);

        history.statistics().values().forEach(stats -> assertEquals(0, stats.getTotalRuns()));
    }

    @Test
    @DisplayName("Queued run should be reported as pending")
    void testGetRun_ShouldReportPendingRun() {
        StoryGenerationServiceImpl service = service(new WritingStep(false), task -> { });

        String runId = service.submit(StoryFixtures.mysteryRequirements(), null);

        assertEquals(WorkflowStatus.PENDING, service.getRun(runId).orElseThrow().getStatus());
        assertTrue(service.getRun("unknown").isEmpty());
    }

    @Test
    @DisplayName("Rejected submission should propagate and leave no trace")
    void testSubmit_ShouldPropagateRejection() {
        StoryGenerationServiceImpl service = service(new WritingStep(false), task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThrows(RejectedExecutionException.class,
                () -> service.submit(StoryFixtures.mysteryRequirements(), null));
        assertEquals(0, service.statistics().getActiveRuns());
    }

    @Test
    @DisplayName("Statistics should include strategy and step figures")
    void testStatistics_ShouldAggregate() {
        StoryGenerationServiceImpl service = service(new WritingStep(false), Runnable::run);
        service.submit(StoryFixtures.mysteryRequirements(), null);

        Map<String, ?> steps = service.statistics().getSteps();

        assertEquals(GenerationStrategy.values().length, service.statistics().getStrategies().size());
        assertTrue(steps.containsKey("content_generation"));
        assertEquals(0, service.statistics().getActiveStreams());
    }

    private StoryGenerationServiceImpl service(WritingStep step, java.util.concurrent.Executor workflowExecutor) {
        WorkflowConfig config = new WorkflowConfig();
        config.setMaxWorkflowTime(Duration.ofSeconds(10));
        GlobalRetryConfig retry = new GlobalRetryConfig();
        retry.setBackoffMs(1);

        StepDefinition definition = StepDefinition.builder()
                .step(step)
                .timeout(Duration.ofSeconds(5))
                .retryCount(0)
                .required(true)
                .build();
        WorkflowRunner runner = new WorkflowRunner(List.of(definition), config, new RetryPolicy(retry), stepExecutor);
        return new StoryGenerationServiceImpl(runner, history, streams, workflowExecutor);
    }

    private static class WritingStep implements WorkflowStep<String> {

        private final boolean fail;

        WritingStep(boolean fail) {
            this.fail = fail;
        }

        @Override
        public String name() {
            return "content_generation";
        }

        @Override
        public WorkflowStage stage() {
            return WorkflowStage.CONTENT_GENERATION;
        }

        @Override
        public String execute(WorkflowContext context) {
            if (fail) {
                throw new IllegalStateException("model unavailable");
            }
            return "The keeper lied.";
        }

        @Override
        public void applyResult(WorkflowContext context, String result) {
            context.setStrategy(GenerationStrategy.ITERATIVE);
            context.setContent(result);
            context.setTitle("The Keeper");
            context.setInitialQuality(QualityVector.uniform(8.0));
        }
    }
}
