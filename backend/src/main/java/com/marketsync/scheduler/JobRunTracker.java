package com.marketsync.scheduler;

import com.marketsync.domain.JobRun;
import com.marketsync.domain.JobRun.JobRunStatus;
import com.marketsync.domain.JobRunRepository;
import com.marketsync.domain.RunStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Owns the JobRun lifecycle: PENDING → RUNNING → SUCCEEDED | FAILED, or PENDING → SKIPPED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRunTracker {

    private final JobRunRepository jobRunRepository;
    private final Clock clock;

    public JobRun open(String jobId, Instant tickTime) {
        JobRun run = new JobRun();
        run.setJobId(jobId);
        run.setTickTime(tickTime);
        run.setStartedAt(clock.instant());
        run.setStatus(JobRunStatus.PENDING);
        return jobRunRepository.save(run);
    }

    public JobRun setRunning(JobRun run) {
        run.setStatus(JobRunStatus.RUNNING);
        return jobRunRepository.save(run);
    }

    public JobRun setSucceeded(JobRun run, RunStats stats) {
        run.setStatus(JobRunStatus.SUCCEEDED);
        run.setStats(stats);
        run.setEndedAt(clock.instant());
        return jobRunRepository.save(run);
    }

    public JobRun setFailed(JobRun run, RunStats stats, String error) {
        run.setStatus(JobRunStatus.FAILED);
        run.setStats(stats);
        run.setError(error);
        run.setEndedAt(clock.instant());
        return jobRunRepository.save(run);
    }

    public JobRun setSkipped(JobRun run, String reason) {
        run.setStatus(JobRunStatus.SKIPPED);
        run.setSkipReason(reason);
        run.setEndedAt(clock.instant());
        return jobRunRepository.save(run);
    }

    /** Records a tick that never got a worker. */
    public JobRun recordSkipped(String jobId, Instant tickTime, String reason) {
        return setSkipped(open(jobId, tickTime), reason);
    }

    /**
     * Runs left PENDING or RUNNING by a previous process can never finish; mark them FAILED so their windows are
     * visibly retried.
     */
    public int failAbandoned() {
        List<JobRun> abandoned = jobRunRepository.findByStatusIn(Set.of(JobRunStatus.PENDING, JobRunStatus.RUNNING));
        for (JobRun run : abandoned) {
            setFailed(run, run.getStats(), "interrupted by restart");
        }
        if (!abandoned.isEmpty()) {
            log.warn("Marked {} abandoned run(s) as FAILED", abandoned.size());
        }
        return abandoned.size();
    }
}
