package com.eyelevel.documentanalysis.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures a central, managed thread pool for handling asynchronous application tasks,
 * such as model calls that outlive their synchronous budget and in-process extraction fallbacks.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the primary thread pool for async tasks. The properties for this pool are
     * configured in application.yaml under the `app.task-executor` prefix.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(
            @Value("${app.task-executor.core-size:8}") int coreSize,
            @Value("${app.task-executor.max-size:32}") int maxSize,
            @Value("${app.task-executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("app-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
