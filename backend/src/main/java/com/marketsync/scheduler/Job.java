package com.marketsync.scheduler;

import com.marketsync.domain.BucketGranularity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated, immutable job definition.
 */
public record Job(
        String id,
        boolean enabled,
        JobSchedule schedule,
        GuardType guard,
        List<StageType> stages,
        List<String> sourceIds,
        List<String> entities,
        List<BucketGranularity> granularities,
        List<String> alertRuleIds,
        List<String> modelIds,
        List<String> retentionPolicyIds,
        Duration maxRunDuration
) {

    public Job {
        stages = List.copyOf(stages);
        sourceIds = List.copyOf(sourceIds);
        entities = List.copyOf(entities);
        granularities = List.copyOf(granularities);
        alertRuleIds = List.copyOf(alertRuleIds);
        modelIds = List.copyOf(modelIds);
        retentionPolicyIds = List.copyOf(retentionPolicyIds);
    }

    public Duration interval() {
        return schedule.interval();
    }

    /** min(interval, maxRunDuration). */
    public Duration deadline() {
        if (maxRunDuration == null || maxRunDuration.compareTo(schedule.interval()) > 0) {
            return schedule.interval();
        }
        return maxRunDuration;
    }

    /**
     * Run-lock keys: one per (job, source); the job id alone when the job reads no source.
     */
    public List<String> runLockKeys() {
        if (sourceIds.isEmpty()) {
            return List.of(id);
        }
        List<String> keys = new ArrayList<>(sourceIds.size());
        for (String sourceId : sourceIds) {
            keys.add(id + "|" + sourceId);
        }
        return keys;
    }
}
