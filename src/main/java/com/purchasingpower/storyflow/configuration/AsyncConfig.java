package com.purchasingpower.storyflow.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for story workflows.
 *
 * <ul>
 *   <li>{@code workflowExecutor} runs one task per submitted story so controllers return immediately.
 *   <li>{@code stepExecutor} runs each step attempt so the runner can time it out and cancel it.
 *   <li>{@code assessmentExecutor} scores quality dimensions in parallel.
 * </ul>
 * The pools are separate because a workflow thread blocks on a step thread, which in turn
 * blocks on assessment threads.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Bean(name = "workflowExecutor")
    @Override
    public Executor getAsyncExecutor() {
        return buildExecutor("workflow-async-", 5, 10, 100);
    }

    @Bean(name = "stepExecutor")
    public ThreadPoolTaskExecutor stepExecutor() {
        return buildExecutor("workflow-step-", 10, 20, 100);
    }

    @Bean(name = "assessmentExecutor")
    public ThreadPoolTaskExecutor assessmentExecutor() {
        return buildExecutor("quality-assess-", 11, 33, 200);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);

        // Wait for tasks to complete on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Executor '{}' configured: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), queue);

        return executor;
    }
}
