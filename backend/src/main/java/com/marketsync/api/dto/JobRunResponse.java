package com.marketsync.api.dto;

import com.marketsync.domain.JobRun;
import com.marketsync.domain.RunStats;

import java.time.Instant;

public record JobRunResponse(
        String id,
        String jobId,
        Instant tickTime,
        Instant startedAt,
        Instant endedAt,
        String status,
        String error,
        String skipReason,
        RunStats stats
) {

    public static JobRunResponse from(JobRun r) {
        return new JobRunResponse(r.getId(), r.getJobId(), r.getTickTime(), r.getStartedAt(), r.getEndedAt(),
                r.getStatus() != null ? r.getStatus().name() : null, r.getError(), r.getSkipReason(), r.getStats());
    }
}
