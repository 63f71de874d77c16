package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.config.WorkflowConfig;
import com.purchasingpower.storyflow.exception.RequiredStepFailureException;
import com.purchasingpower.storyflow.exception.StepExecutionException;
import com.purchasingpower.storyflow.exception.StepTimeoutException;
import com.purchasingpower.storyflow.exception.StoryFlowException;
import com.purchasingpower.storyflow.exception.WorkflowTimeBudgetExceededException;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.StepTiming;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StoryResult;
import com.purchasingpower.storyflow.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes the registered steps of a story run, strictly in registration order, against one
 * {@link WorkflowContext}.
 *
 * <p>For each step:
 * <ul>
 *   <li>progress is set to {@code index / stepCount} and the listener is notified
 *   <li>each attempt runs on the step executor and is cancelled when it exceeds the step
 *       timeout (or the remaining run budget, whichever is shorter)
 *   <li>retryable failures are retried up to the step's retry count, waiting
 *       {@link RetryPolicy#backoff(int)} between attempts. A timed-out attempt is interrupted
 *       and awaited until it returns, so attempts never overlap. One that ignores the interrupt
 *       holds the runner until the run budget is gone, and the run then fails on its budget
 *   <li>a required step that runs out of attempts aborts the run with
 *       {@link RequiredStepFailureException}; an optional one is handled according to
 *       {@link WorkflowConfig.OptionalStepFailurePolicy}. Under CONTINUE the step gets its last
 *       error through {@link WorkflowStep#applyFailure}
 * </ul>
 * After the last step the run moves to finalization with progress 1.0 and a {@link StoryResult}
 * is assembled from the context. A run that exceeds {@code max-workflow-time} fails with
 * {@link WorkflowTimeBudgetExceededException}. Run state is dropped when the run ends; nothing
 * is persisted or resumable.
 */
@Slf4j
public class WorkflowRunner {

    private final List<StepDefinition> steps;
    private final List<String> stepNames;
    private final WorkflowConfig config;
    private final RetryPolicy retryPolicy;
    private final ExecutorService stepExecutor;
    private final StepPerformanceTracker performanceTracker = new StepPerformanceTracker();
    private final Map<String, WorkflowRun> activeRuns = new ConcurrentHashMap<>();

    public WorkflowRunner(List<StepDefinition> steps, WorkflowConfig config,
                          RetryPolicy retryPolicy, ExecutorService stepExecutor) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("At least one workflow step is required");
        }
        Set<String> names = new HashSet<>();
        for (StepDefinition step : steps) {
            if (!names.add(step.getName())) {
                throw new IllegalArgumentException("Duplicate workflow step: " + step.getName());
            }
        }
        this.steps = List.copyOf(steps);
        this.stepNames = this.steps.stream().map(StepDefinition::getName).toList();
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.stepExecutor = stepExecutor;

        log.info("🧩 Workflow registered with {} steps: {}", steps.size(), stepNames);
    }

    public StoryResult execute(StoryRequirements requirements, GenerationStrategy requestedStrategy,
                               ProgressListener listener) {
        return execute(UUID.randomUUID().toString(), requirements, requestedStrategy, listener);
    }

    /**
     * Run all steps for one request.
     *
     * @param requestedStrategy strategy forced by the caller, or null to let strategy selection decide
     * @param listener          optional synchronous progress observer
     * @throws StoryFlowException when the run aborts
     */
    public StoryResult execute(String runId, StoryRequirements requirements, GenerationStrategy requestedStrategy,
                               ProgressListener listener) {
        ProgressListener observer = listener != null ? listener : ProgressListener.NONE;
        WorkflowRun run = new WorkflowRun(runId, stepNames, steps.get(0).getStage());
        if (activeRuns.putIfAbsent(runId, run) != null) {
            throw new IllegalArgumentException("Run already active: " + runId);
        }

        WorkflowContext context = new WorkflowContext(runId, requirements, requestedStrategy);
        Instant deadline = run.getStartedAt().plus(config.getMaxWorkflowTime());
        List<StepTiming> timings = new ArrayList<>();

        log.info("🚀 Starting workflow {} ({} steps, budget {}s)",
                runId, steps.size(), config.getMaxWorkflowTime().toSeconds());

        try {
            for (int i = 0; i < steps.size(); i++) {
                StepDefinition definition = steps.get(i);
                if (remaining(deadline).isZero()) {
                    throw budgetExceeded(run, definition.getName());
                }
                run.beginStep(definition.getName(), definition.getStage(), (double) i / steps.size());
                notifyListener(observer, run);

                timings.add(executeStep(definition, definition.getStep(), context, run, deadline));
            }

            run.finish();
            notifyListener(observer, run);

            StoryResult result = assemble(context, run, timings);
            log.info("🏁 Workflow {} completed in {}ms: \"{}\" ({} words, quality {})",
                    runId, result.getTotalDuration().toMillis(), result.getTitle(), result.getWordCount(),
                    result.getFinalQuality() != null ? result.getFinalQuality().getOverall() : "n/a");
            return result;

        } catch (RuntimeException e) {
            run.abort(e.getMessage());
            notifyListener(observer, run);
            log.error("❌ Workflow {} aborted: {}", runId, e.getMessage());
            throw e;

        } finally {
            activeRuns.remove(runId);
        }
    }

    private <T> StepTiming executeStep(StepDefinition definition, WorkflowStep<T> step, WorkflowContext context,
                                       WorkflowRun run, Instant deadline) {
        String name = definition.getName();
        Instant stepStart = Instant.now();
        List<Duration> backoffs = new ArrayList<>();
        int attempts = 0;
        StepOutcome<T> outcome;

        log.info("▶️ [{}] Step '{}' ({}) starting", run.getRunId(), name, definition.getStage());

        while (true) {
            attempts++;
            Duration remaining = remaining(deadline);
            if (remaining.isZero()) {
                throw budgetExceeded(run, name);
            }
            boolean budgetLimited = remaining.compareTo(definition.getTimeout()) < 0;

            outcome = attempt(step, context, budgetLimited ? remaining : definition.getTimeout(), deadline);
            if (outcome.isSuccess()) {
                break;
            }
            if (outcome.isTimedOut() && budgetLimited) {
                throw budgetExceeded(run, name);
            }

            log.warn("⚠️ [{}] Step '{}' attempt {}/{} failed: {}",
                    run.getRunId(), name, attempts, definition.getMaxAttempts(), outcome.describe());

            if (!retryPolicy.shouldRetry(outcome, attempts, definition)) {
                break;
            }
            Duration backoff = retryPolicy.backoff(attempts - 1);
            backOff(backoff, run, name, deadline);
            backoffs.add(backoff);
        }

        Duration elapsed = Duration.between(stepStart, Instant.now());
        performanceTracker.record(name, elapsed);
        StepTiming.StepTimingBuilder timing = StepTiming.builder()
                .stepName(name)
                .stage(definition.getStage())
                .attempts(attempts)
                .retries(attempts - 1)
                .backoffs(List.copyOf(backoffs))
                .elapsed(elapsed)
                .required(definition.isRequired());

        if (outcome.isSuccess()) {
            step.applyResult(context, outcome.getValue());
            run.completeStep(name);
            log.info("✅ [{}] Step '{}' completed in {}ms ({} attempt(s))",
                    run.getRunId(), name, elapsed.toMillis(), attempts);
            return timing.succeeded(true).build();
        }

        StoryFlowException failure = outcome.isTimedOut()
                ? new StepTimeoutException(name, attempts, definition.getTimeout())
                : new StepExecutionException(name, attempts, outcome.getError());
        run.failStep(name, failure.getMessage());

        if (definition.isRequired()) {
            throw new RequiredStepFailureException(name, attempts, failure);
        }
        if (config.getOptionalStepFailurePolicy() == WorkflowConfig.OptionalStepFailurePolicy.ABORT) {
            throw failure;
        }

        log.warn("⚠️ [{}] Optional step '{}' failed, continuing: {}", run.getRunId(), name, failure.getMessage());
        step.applyFailure(context, outcome.getError());
        return timing.succeeded(false).error(failure.getMessage()).build();
    }

    private <T> StepOutcome<T> attempt(WorkflowStep<T> step, WorkflowContext context, Duration wait,
                                       Instant deadline) {
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch stopped = new CountDownLatch(1);
        Future<T> future = stepExecutor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return step.execute(context);
            } finally {
                stopped.countDown();
            }
        });
        try {
            return StepOutcome.success(future.get(wait.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            if (claimed.compareAndSet(false, true)) {
                // never started
                return StepOutcome.timedOut();
            }
            awaitStopped(step, stopped, deadline);
            return StepOutcome.timedOut();
        } catch (ExecutionException e) {
            return retryPolicy.classify(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoryFlowException("Workflow interrupted during step '" + step.name() + "'", e, false);
        }
    }

    private void awaitStopped(WorkflowStep<?> step, CountDownLatch stopped, Instant deadline) {
        try {
            if (!stopped.await(remaining(deadline).toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ Step '{}' ignored cancellation and is still running", step.name());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoryFlowException("Workflow interrupted while stopping step '" + step.name() + "'", e, false);
        }
    }

    private void backOff(Duration backoff, WorkflowRun run, String stepName, Instant deadline) {
        if (backoff.compareTo(remaining(deadline)) >= 0) {
            throw budgetExceeded(run, stepName);
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoryFlowException("Workflow interrupted while backing off step '" + stepName + "'", e, false);
        }
    }

    private WorkflowTimeBudgetExceededException budgetExceeded(WorkflowRun run, String stepName) {
        return new WorkflowTimeBudgetExceededException(run.getRunId(), stepName, config.getMaxWorkflowTime(),
                Duration.between(run.getStartedAt(), Instant.now()));
    }

    private static Duration remaining(Instant deadline) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void notifyListener(ProgressListener listener, WorkflowRun run) {
        try {
            listener.onProgress(run.snapshot());
        } catch (RuntimeException e) {
            log.warn("⚠️ Progress listener failed for run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    private static StoryResult assemble(WorkflowContext context, WorkflowRun run, List<StepTiming> timings) {
        return StoryResult.builder()
                .runId(context.getRunId())
                .title(context.getTitle())
                .content(context.getContent())
                .wordCount(ExternalCallLogger.countWords(context.getContent()))
                .requirements(context.getRequirements())
                .strategy(context.getStrategy())
                .recommendation(context.getRecommendation())
                .analysis(context.getAnalysis())
                .outline(context.getOutline())
                .initialQuality(context.getInitialQuality())
                .finalQuality(context.currentQuality())
                .enhancement(context.getEnhancement())
                .completedSteps(run.completedSteps())
                .failedSteps(run.failedSteps())
                .stepTimings(List.copyOf(timings))
                .startedAt(run.getStartedAt())
                .totalDuration(Duration.between(run.getStartedAt(), Instant.now()))
                .build();
    }

    public List<String> getStepNames() {
        return stepNames;
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Optional<WorkflowRunSnapshot> activeRun(String runId) {
        WorkflowRun run = activeRuns.get(runId);
        return run == null ? Optional.empty() : Optional.of(run.snapshot());
    }

    public List<WorkflowRunSnapshot> activeRuns() {
        return activeRuns.values().stream().map(WorkflowRun::snapshot).toList();
    }

    public Map<String, StepPerformanceTracker.StepStatistics> stepStatistics() {
        return performanceTracker.statistics();
    }
}
