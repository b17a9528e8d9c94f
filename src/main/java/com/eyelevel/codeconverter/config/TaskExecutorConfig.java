package com.eyelevel.codeconverter.config;

import org.springframework.boot.autoconfigure.task.TaskExecutionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the thread pool that reads records and drives conversion runs off the caller's thread.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the application thread pool, sized by the `spring.task.execution.pool` properties
     * in application.yaml.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(TaskExecutionProperties taskExecutionProperties) {
        TaskExecutionProperties.Pool pool = taskExecutionProperties.getPool();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCoreSize());
        executor.setMaxPoolSize(pool.getMaxSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("conversion-");
        executor.initialize();
        return executor;
    }
}
