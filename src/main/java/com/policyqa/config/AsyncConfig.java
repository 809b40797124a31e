package com.policyqa.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "indexingTaskExecutor")
    public Executor indexingTaskExecutor(@Value("${app.indexing.max-concurrent-tasks:4}") int concurrency) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("indexing-");
        executor.setConcurrencyLimit(concurrency);
        return executor;
    }

    @Bean(name = "queryTaskExecutor")
    public AsyncTaskExecutor queryTaskExecutor(PipelineProperties properties) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("query-");
        executor.setConcurrencyLimit(properties.maxConcurrentQueries());
        return executor;
    }

    /**
     * Stage work runs here so the orchestrator can wait with a deadline and interrupt what overruns it.
     */
    @Bean(name = "stageTaskExecutor")
    public ThreadPoolTaskExecutor stageTaskExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("stage-");
        executor.setCorePoolSize(properties.maxConcurrentQueries());
        executor.setMaxPoolSize(properties.maxConcurrentQueries() * 2);
        executor.setQueueCapacity(properties.maxConcurrentQueries() * 4);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
