package com.marketsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: job-executor runs one job run per due job per tick; notify-executor delivers alerts
 * to sinks so notification latency never holds a job worker.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String JOB_EXECUTOR = "job-executor";
    public static final String NOTIFY_EXECUTOR = "notify-executor";

    @Bean(name = JOB_EXECUTOR)
    public Executor jobExecutor(
            @Value("${marketsync.scheduler.worker-threads:4}") int workerThreads,
            @Value("${marketsync.scheduler.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        int workers = Math.max(1, workerThreads);
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setQueueCapacity(queueCapacity);
        e.setThreadNamePrefix("job-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFY_EXECUTOR)
    public Executor notifyExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
