package com.marketsync.scheduler;

import com.marketsync.domain.JobRun.JobRunStatus;

import java.time.Duration;
import java.time.Instant;

public record JobHealth(
        String jobId,
        boolean enabled,
        Duration interval,
        Instant lastRunTick,
        JobRunStatus lastRunStatus,
        Instant lastSuccessTick,
        Instant nextDue,
        Status status
) {

    public enum Status {
        OVERDUE,
        DUE_SOON,
        HEALTHY,
        DISABLED
    }
}
