package com.marketsync.scheduler;

import com.marketsync.domain.JobRun;
import com.marketsync.domain.JobRun.JobRunStatus;
import com.marketsync.domain.JobRunRepository;
import com.marketsync.scheduler.JobHealth.Status;
import com.marketsync.scheduler.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Schedule status per job: OVERDUE when the last successful tick (the first attempted tick while none succeeded)
 * is older than overdueFactor × interval, DUE_SOON when the next slot is close, else HEALTHY.
 */
@Service
@RequiredArgsConstructor
public class JobHealthService {

    private final JobCatalog jobCatalog;
    private final JobScheduler jobScheduler;
    private final JobRunRepository jobRunRepository;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public List<JobHealth> all() {
        Instant now = clock.instant();
        return jobCatalog.all().stream().map(job -> health(job, now)).toList();
    }

    public List<JobRun> runs(String jobId, JobRunStatus status, int limit) {
        if (jobCatalog.find(jobId).isEmpty()) {
            throw new NoSuchElementException("Unknown job " + jobId);
        }
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 500)));
        return status == null
                ? jobRunRepository.findByJobIdOrderByTickTimeDesc(jobId, page)
                : jobRunRepository.findByJobIdAndStatusOrderByTickTimeDesc(jobId, status, page);
    }

    JobHealth health(Job job, Instant now) {
        Optional<JobRun> last = jobRunRepository.findFirstByJobIdOrderByTickTimeDesc(job.id());
        Instant lastSuccess = jobRunRepository.findFirstByJobIdAndStatusOrderByTickTimeDesc(job.id(), JobRunStatus.SUCCEEDED)
                .map(JobRun::getTickTime)
                .orElse(null);
        Instant lastTick = last.map(JobRun::getTickTime).orElse(null);
        Instant firstTick = jobRunRepository.findFirstByJobIdOrderByTickTimeAsc(job.id())
                .map(JobRun::getTickTime)
                .orElse(null);
        Instant nextDue = jobScheduler.nextDue(job.id())
                .orElseGet(() -> job.schedule().nextSlotAfter(lastTick));
        return new JobHealth(
                job.id(),
                job.enabled(),
                job.interval(),
                lastTick,
                last.map(JobRun::getStatus).orElse(null),
                lastSuccess,
                nextDue,
                classify(job, lastSuccess != null ? lastSuccess : firstTick, nextDue, now, schedulerProperties));
    }

    /**
     * @param reference last successful tick, or the first tick ever attempted when none succeeded; null before the
     *                  first run
     */
    static Status classify(Job job, Instant reference, Instant nextDue, Instant now, SchedulerProperties props) {
        if (!job.enabled()) {
            return Status.DISABLED;
        }
        long toleratedMs = (long) (job.interval().toMillis() * props.getOverdueFactor());
        if (reference != null && now.isAfter(reference) && Duration.between(reference, now).toMillis() > toleratedMs) {
            return Status.OVERDUE;
        }
        if (nextDue != null && !nextDue.isAfter(now.plus(props.getDueSoonWithin()))) {
            return Status.DUE_SOON;
        }
        return Status.HEALTHY;
    }
}
