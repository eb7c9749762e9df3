package com.marketsync.scheduler;

import com.marketsync.domain.BucketGranularity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

final class TestJobs {

    static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    private TestJobs() {
    }

    static Job syncJob(String id, Duration interval, List<StageType> stages) {
        return new Job(id, true, new JobSchedule(interval, START, null), GuardType.ALWAYS, stages,
                List.of("cmc"), List.of(), List.of(BucketGranularity.HOURLY), List.of(), List.of(), List.of(), null);
    }

    static Job withGuard(Job job, GuardType guard) {
        return new Job(job.id(), job.enabled(), job.schedule(), guard, job.stages(), job.sourceIds(), job.entities(),
                job.granularities(), job.alertRuleIds(), job.modelIds(), job.retentionPolicyIds(), job.maxRunDuration());
    }

    static Job disabled(Job job) {
        return new Job(job.id(), false, job.schedule(), job.guard(), job.stages(), job.sourceIds(), job.entities(),
                job.granularities(), job.alertRuleIds(), job.modelIds(), job.retentionPolicyIds(), job.maxRunDuration());
    }

    /** Clock whose instant the test moves explicitly. */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
