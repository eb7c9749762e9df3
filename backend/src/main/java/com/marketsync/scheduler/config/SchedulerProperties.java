package com.marketsync.scheduler.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * marketsync.scheduler.*
 */
@ConfigurationProperties(prefix = "marketsync.scheduler")
@NoArgsConstructor
@Getter
@Setter
public class SchedulerProperties {

    /** When false no tick loop is registered; jobs only run through the trigger API. */
    private boolean enabled = true;

    private long tickIntervalMs = 1_000;

    /** job-executor size: at most this many runs in parallel. */
    private int workerThreads = 4;

    private int queueCapacity = 100;

    /** A job is OVERDUE when its last successful tick is older than overdueFactor × interval. */
    private double overdueFactor = 2.0;

    /** A job is DUE_SOON when its next slot is within this window. */
    private Duration dueSoonWithin = Duration.ofMinutes(5);
}
