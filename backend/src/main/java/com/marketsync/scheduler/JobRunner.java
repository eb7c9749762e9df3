package com.marketsync.scheduler;

import com.marketsync.common.KeyedLocks;
import com.marketsync.config.AsyncConfig;
import com.marketsync.domain.JobRun;
import com.marketsync.ingestion.store.WatermarkStore;
import com.marketsync.scheduler.stage.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Executes one run of a job for one tick:
 * <ol>
 *   <li>claim the (job, source) run locks, or record SKIPPED "previous run in flight";</li>
 *   <li>evaluate the guard, or record SKIPPED with its reason (no stage runs);</li>
 *   <li>run the stages in the job's order under the deadline min(interval, maxRunDuration);</li>
 *   <li>commit staged watermarks only after every stage succeeded.</li>
 * </ol>
 * Any failure marks the run FAILED and leaves every watermark untouched, so the next tick retries the same window.
 */
@Component
@Slf4j
public class JobRunner {

    static final String IN_FLIGHT = "previous run in flight";

    private final JobRunTracker jobRunTracker;
    private final GuardEvaluator guardEvaluator;
    private final WatermarkStore watermarkStore;
    private final JobCatalog jobCatalog;
    private final Map<StageType, PipelineStage> stages = new EnumMap<>(StageType.class);
    private final Executor jobExecutor;
    private final Clock clock;
    private final KeyedLocks runLocks = new KeyedLocks();

    public JobRunner(
            JobRunTracker jobRunTracker,
            GuardEvaluator guardEvaluator,
            WatermarkStore watermarkStore,
            JobCatalog jobCatalog,
            List<PipelineStage> pipelineStages,
            @Qualifier(AsyncConfig.JOB_EXECUTOR) Executor jobExecutor,
            Clock clock) {
        this.jobRunTracker = jobRunTracker;
        this.guardEvaluator = guardEvaluator;
        this.watermarkStore = watermarkStore;
        this.jobCatalog = jobCatalog;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        for (PipelineStage stage : pipelineStages) {
            if (this.stages.put(stage.type(), stage) != null) {
                throw new IllegalStateException("Two pipeline stages for " + stage.type());
            }
        }
    }

    public JobRun run(Job job, Instant tickTime) {
        JobRun run = jobRunTracker.open(job.id(), tickTime);
        List<String> lockKeys = job.runLockKeys();
        if (!runLocks.tryClaimAll(lockKeys)) {
            log.info("Job {} tick {} skipped: {}", job.id(), tickTime, IN_FLIGHT);
            return jobRunTracker.setSkipped(run, IN_FLIGHT);
        }
        StageContext context = new StageContext(job, tickTime, clock.instant().plus(job.deadline()), clock);
        try {
            Optional<String> skipReason = guardEvaluator.skipReason(job, tickTime);
            if (skipReason.isPresent()) {
                log.info("Job {} tick {} skipped: {}", job.id(), tickTime, skipReason.get());
                return jobRunTracker.setSkipped(run, skipReason.get());
            }
            run = jobRunTracker.setRunning(run);
            log.info("Job {} tick {} started", job.id(), tickTime);
            for (StageType type : job.stages()) {
                context.checkDeadline();
                stageFor(type).execute(context);
            }
            context.checkDeadline();
            context.getPendingWatermarks().forEach((sourceId, candidate) ->
                    watermarkStore.advance(job.id(), sourceId, candidate));
            JobRun done = jobRunTracker.setSucceeded(run, context.getStats());
            log.info("Job {} tick {} succeeded: fetched={} stored={} buckets={} alerts={}", job.id(), tickTime,
                    context.getStats().getRecordsFetched(), context.getStats().getRecordsStored(),
                    context.getStats().getBucketsRebuilt(), context.getStats().getAlertsRaised());
            return done;
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Job {} tick {} failed: {}", job.id(), tickTime, error, e);
            return jobRunTracker.setFailed(run, context.getStats(), error);
        } finally {
            runLocks.releaseAll(lockKeys);
        }
    }

    /**
     * Manual trigger at the current instant, run on job-executor.
     *
     * @throws NoSuchElementException for an unknown job id
     */
    public CompletableFuture<JobRun> runNow(String jobId) {
        Job job = jobCatalog.find(jobId).orElseThrow(() -> new NoSuchElementException("Unknown job " + jobId));
        Instant tickTime = clock.instant();
        log.info("Manual trigger of job {} at {}", jobId, tickTime);
        return CompletableFuture.supplyAsync(() -> run(job, tickTime), jobExecutor);
    }

    boolean isInFlight(Job job) {
        return job.runLockKeys().stream().anyMatch(runLocks::isClaimed);
    }

    private PipelineStage stageFor(StageType type) {
        PipelineStage stage = stages.get(type);
        if (stage == null) {
            throw new IllegalStateException("No pipeline stage registered for " + type);
        }
        return stage;
    }
}
