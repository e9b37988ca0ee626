package com.tmdbsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the fetch phase. Admission is bounded by the scheduler's window, not by the queue.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";

    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor fetchExecutor(@Value("${tmdbsync.ingestion.fetch.worker-threads:64}") int workerThreads) {
        int threads = Math.max(1, workerThreads);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("fetch-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
