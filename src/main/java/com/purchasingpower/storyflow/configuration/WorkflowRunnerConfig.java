package com.purchasingpower.storyflow.configuration;

import com.purchasingpower.storyflow.config.GlobalRetryConfig;
import com.purchasingpower.storyflow.config.WorkflowConfig;
import com.purchasingpower.storyflow.workflow.RetryPolicy;
import com.purchasingpower.storyflow.workflow.StepDefinition;
import com.purchasingpower.storyflow.workflow.WorkflowRunner;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Wires the workflow runner from the step beans.
 *
 * <p>Steps are registered in {@code @Order} order; their timeout, retry count and required flag
 * come from {@code app.workflow.steps.<name>}.
 */
@Slf4j
@Configuration
public class WorkflowRunnerConfig {

    @Bean
    public RetryPolicy retryPolicy(GlobalRetryConfig retryConfig) {
        return new RetryPolicy(retryConfig);
    }

    @Bean
    public WorkflowRunner workflowRunner(List<WorkflowStep<?>> steps,
                                         WorkflowConfig workflowConfig,
                                         RetryPolicy retryPolicy,
                                         @Qualifier("stepExecutor") ThreadPoolTaskExecutor stepExecutor) {
        List<StepDefinition> definitions = steps.stream()
                .map(step -> StepDefinition.of(step, workflowConfig.settingsFor(step.name())))
                .toList();

        definitions.forEach(d -> log.debug("Step '{}': timeout={}s, retries={}, required={}",
                d.getName(), d.getTimeout().toSeconds(), d.getRetryCount(), d.isRequired()));

        return new WorkflowRunner(definitions, workflowConfig, retryPolicy, stepExecutor.getThreadPoolExecutor());
    }
}
