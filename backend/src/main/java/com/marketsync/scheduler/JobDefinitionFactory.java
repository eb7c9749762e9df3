package com.marketsync.scheduler;

import com.marketsync.alerting.rule.AlertRuleRegistry;
import com.marketsync.common.ConfigurationException;
import com.marketsync.ingestion.source.SourceRegistry;
import com.marketsync.retention.RetentionPolicyRegistry;
import com.marketsync.scheduler.config.JobProperties.JobDefinition;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw job definitions into immutable Jobs. Any invalid definition is a {@link ConfigurationException}.
 */
@RequiredArgsConstructor
public class JobDefinitionFactory {

    private final SourceRegistry sourceRegistry;
    private final AlertRuleRegistry alertRuleRegistry;
    private final RetentionPolicyRegistry retentionPolicyRegistry;
    private final boolean forecasterAvailable;

    public List<Job> createAll(List<JobDefinition> definitions, Instant registeredAt) {
        Set<String> ids = new HashSet<>();
        List<Job> jobs = new ArrayList<>();
        for (JobDefinition d : definitions) {
            Job job = create(d, registeredAt);
            if (!ids.add(job.id())) {
                throw new ConfigurationException("Duplicate job id " + job.id());
            }
            jobs.add(job);
        }
        return jobs;
    }

    public Job create(JobDefinition d, Instant registeredAt) {
        if (d.getId() == null || d.getId().isBlank()) {
            throw new ConfigurationException("Job without id");
        }
        String id = d.getId();
        Duration interval = d.getInterval();
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new ConfigurationException("Job " + id + " needs a positive interval");
        }
        if (d.getMaxRunDuration() != null && (d.getMaxRunDuration().isNegative() || d.getMaxRunDuration().isZero())) {
            throw new ConfigurationException("Job " + id + " has a non-positive max-run-duration");
        }
        if (d.getStages().isEmpty()) {
            throw new ConfigurationException("Job " + id + " has no stages");
        }
        if (new HashSet<>(d.getStages()).size() != d.getStages().size()) {
            throw new ConfigurationException("Job " + id + " lists a stage twice");
        }
        Instant startAt = d.getStartAt() != null ? d.getStartAt()
                : d.isStartNow() ? registeredAt : Instant.EPOCH;
        if (d.getEndAt() != null && !d.getEndAt().isAfter(startAt)) {
            throw new ConfigurationException("Job " + id + " ends before it starts");
        }
        List<String> entities = d.getEntities().stream().map(e -> e.toUpperCase(Locale.ROOT)).toList();

        for (String sourceId : d.getSources()) {
            if (!sourceRegistry.contains(sourceId)) {
                throw new ConfigurationException("Job " + id + " references unknown source " + sourceId);
            }
        }
        if ((d.getStages().contains(StageType.INGEST) || d.getGuard() == GuardType.NEW_SOURCE_DATA) && d.getSources().isEmpty()) {
            throw new ConfigurationException("Job " + id + " ingests or guards on source data but lists no sources");
        }
        if (d.getGuard() == GuardType.RECENT_RECORDS && entities.isEmpty()) {
            throw new ConfigurationException("Job " + id + " guards on recent records but lists no entities");
        }
        if ((d.getStages().contains(StageType.AGGREGATE) || d.getStages().contains(StageType.ALERT))
                && d.getGranularities().isEmpty()) {
            throw new ConfigurationException("Job " + id + " aggregates or alerts but lists no granularities");
        }
        if (d.getStages().contains(StageType.AGGREGATE) && !d.getStages().contains(StageType.INGEST) && entities.isEmpty()) {
            throw new ConfigurationException("Job " + id + " aggregates without ingesting but lists no entities");
        }
        for (String ruleId : d.getAlertRules()) {
            if (!alertRuleRegistry.contains(ruleId)) {
                throw new ConfigurationException("Job " + id + " references unknown alert rule " + ruleId);
            }
        }
        boolean modelStage = d.getStages().contains(StageType.FORECAST) || d.getStages().contains(StageType.DRIFT_CHECK);
        if (modelStage && d.getModels().isEmpty()) {
            throw new ConfigurationException("Job " + id + " has a model stage but lists no models");
        }
        if (d.getStages().contains(StageType.FORECAST)) {
            if (!forecasterAvailable) {
                throw new ConfigurationException("Job " + id + " forecasts but no Forecaster bean is registered");
            }
            if (entities.isEmpty()) {
                throw new ConfigurationException("Job " + id + " forecasts but lists no entities");
            }
        }
        if (d.getStages().contains(StageType.RETENTION) && d.getRetentionPolicies().isEmpty()) {
            throw new ConfigurationException("Job " + id + " has a retention stage but lists no policies");
        }
        for (String policyId : d.getRetentionPolicies()) {
            if (!retentionPolicyRegistry.contains(policyId)) {
                throw new ConfigurationException("Job " + id + " references unknown retention policy " + policyId);
            }
        }
        return new Job(
                id,
                d.isEnabled(),
                new JobSchedule(interval, startAt, d.getEndAt()),
                d.getGuard() == null ? GuardType.ALWAYS : d.getGuard(),
                d.getStages(),
                d.getSources(),
                entities,
                d.getGranularities(),
                d.getAlertRules(),
                d.getModels(),
                d.getRetentionPolicies(),
                d.getMaxRunDuration());
    }
}
