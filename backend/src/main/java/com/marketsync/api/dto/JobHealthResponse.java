package com.marketsync.api.dto;

import com.marketsync.scheduler.JobHealth;

import java.time.Instant;

public record JobHealthResponse(
        String jobId,
        boolean enabled,
        String interval,
        Instant lastRunTick,
        String lastRunStatus,
        Instant lastSuccessTick,
        Instant nextDue,
        String status
) {

    public static JobHealthResponse from(JobHealth h) {
        return new JobHealthResponse(
                h.jobId(),
                h.enabled(),
                h.interval().toString(),
                h.lastRunTick(),
                h.lastRunStatus() != null ? h.lastRunStatus().name() : null,
                h.lastSuccessTick(),
                h.nextDue(),
                h.status().name());
    }
}
