package com.marketsync.scheduler;

import com.marketsync.config.AsyncConfig;
import com.marketsync.domain.JobRun;
import com.marketsync.domain.JobRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Tracks the next slot of every registered job and dispatches due runs to job-executor.
 * <p>
 * Only the latest due slot is dispatched: slots missed while the service was down collapse into one run.
 * After a restart scheduling resumes after the last persisted tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobScheduler {

    private static final class ScheduledJob {
        private final Job job;
        private volatile Instant lastSlot;

        private ScheduledJob(Job job, Instant lastSlot) {
            this.job = job;
            this.lastSlot = lastSlot;
        }
    }

    private final Map<String, ScheduledJob> scheduled = new ConcurrentHashMap<>();

    private final JobRunner jobRunner;
    private final JobRunTracker jobRunTracker;
    private final JobRunRepository jobRunRepository;
    private final JobCatalog jobCatalog;
    @Qualifier(AsyncConfig.JOB_EXECUTOR)
    private final Executor jobExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        jobRunTracker.failAbandoned();
        jobCatalog.all().forEach(this::schedule);
    }

    public void schedule(Job job) {
        if (!job.enabled()) {
            log.info("Job {} is disabled; not scheduled", job.id());
            return;
        }
        Instant lastTick = jobRunRepository.findFirstByJobIdOrderByTickTimeDesc(job.id())
                .map(JobRun::getTickTime)
                .orElse(null);
        scheduled.put(job.id(), new ScheduledJob(job, lastTick));
        log.info("Scheduled job {} every {} (next slot {})", job.id(), job.interval(),
                job.schedule().nextSlotAfter(lastTick));
    }

    /**
     * Dispatches one run per job whose latest slot at or before {@code now} has not been dispatched yet.
     *
     * @return number of runs dispatched
     */
    public int tick(Instant now) {
        int dispatched = 0;
        for (ScheduledJob s : scheduled.values()) {
            Instant slot = s.job.schedule().latestSlotAtOrBefore(now);
            if (slot == null || (s.lastSlot != null && !slot.isAfter(s.lastSlot))) {
                continue;
            }
            s.lastSlot = slot;
            Job job = s.job;
            try {
                jobExecutor.execute(() -> jobRunner.run(job, slot));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.warn("Job {} tick {} rejected by job-executor: {}", job.id(), slot, e.getMessage());
                jobRunTracker.recordSkipped(job.id(), slot, "worker pool saturated");
            }
        }
        return dispatched;
    }

    public Optional<Instant> nextDue(String jobId) {
        ScheduledJob s = scheduled.get(jobId);
        return s == null ? Optional.empty() : Optional.ofNullable(s.job.schedule().nextSlotAfter(s.lastSlot));
    }

    public boolean isScheduled(String jobId) {
        return scheduled.containsKey(jobId);
    }
}
