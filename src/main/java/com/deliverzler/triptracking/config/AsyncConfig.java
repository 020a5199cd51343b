package com.deliverzler.triptracking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Threads of the tracking engine.
 *
 * - trackingLoopExecutor: exactly one thread, every position update runs here in order
 * - locationTaskExecutor: GPS uploads, final syncs and automatic trip ends
 * - trackingScheduler:    watchdog, remote status poll and stream resubscribe timers
 */
@Configuration
public class AsyncConfig {

    @Bean("trackingLoopExecutor")
    public Executor trackingLoopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("tracking-loop-");
        // Backpressure: caller thread processes when queue is full, no fix is dropped
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("locationTaskExecutor")
    public Executor locationTaskExecutor(@Value("${tracking.task-pool.core-size:4}") int coreSize,
                                         @Value("${tracking.task-pool.max-size:16}") int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("location-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("trackingScheduler")
    public ThreadPoolTaskScheduler trackingScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("tracking-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
