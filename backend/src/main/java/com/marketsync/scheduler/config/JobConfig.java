package com.marketsync.scheduler.config;

import com.marketsync.alerting.rule.AlertRuleRegistry;
import com.marketsync.drift.Forecaster;
import com.marketsync.ingestion.source.SourceRegistry;
import com.marketsync.retention.RetentionPolicyRegistry;
import com.marketsync.scheduler.Job;
import com.marketsync.scheduler.JobCatalog;
import com.marketsync.scheduler.JobDefinitionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Validates marketsync.jobs at startup; an invalid definition stops the context.
 */
@Configuration
@EnableConfigurationProperties({ SchedulerProperties.class, JobProperties.class })
@Slf4j
public class JobConfig {

    @Bean
    public JobCatalog jobCatalog(
            JobProperties jobProperties,
            SourceRegistry sourceRegistry,
            AlertRuleRegistry alertRuleRegistry,
            RetentionPolicyRegistry retentionPolicyRegistry,
            ObjectProvider<Forecaster> forecaster,
            Clock clock) {
        JobDefinitionFactory factory = new JobDefinitionFactory(
                sourceRegistry, alertRuleRegistry, retentionPolicyRegistry, forecaster.getIfAvailable() != null);
        List<Job> jobs = factory.createAll(jobProperties.getJobs(), clock.instant());
        log.info("Loaded {} job definition(s): {}", jobs.size(), jobs.stream().map(Job::id).toList());
        return new JobCatalog(jobs);
    }
}
