package com.marketsync.scheduler.stage;

import com.marketsync.aggregation.BucketRange;
import com.marketsync.alerting.AlertEngine;
import com.marketsync.alerting.rule.AlertRule;
import com.marketsync.alerting.rule.AlertRuleRegistry;
import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.Alert;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.source.SourceRegistry;
import com.marketsync.scheduler.Job;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates the job's rules for each entity over the buckets rebuilt in this run plus the current window of every
 * granularity (so staleness rules fire even when nothing new arrived). A job without its own entity list covers
 * the allow-lists of its sources, so an entity whose feed went silent is still evaluated.
 */
@Component
@RequiredArgsConstructor
public class AlertStage implements PipelineStage {

    private final AlertEngine alertEngine;
    private final AlertRuleRegistry alertRuleRegistry;
    private final SourceRegistry sourceRegistry;

    @Override
    public StageType type() {
        return StageType.ALERT;
    }

    @Override
    public void execute(StageContext context) {
        Job job = context.getJob();
        List<AlertRule> rules = job.alertRuleIds().isEmpty()
                ? alertRuleRegistry.all()
                : job.alertRuleIds().stream().map(alertRuleRegistry::get).toList();
        int raised = 0;
        for (Map.Entry<String, Set<BucketRange>> e : windows(context).entrySet()) {
            for (BucketRange window : e.getValue()) {
                context.checkDeadline();
                List<Alert> alerts = alertEngine.evaluate(e.getKey(), window, rules);
                raised += alerts.size();
            }
        }
        context.getStats().setAlertsRaised(context.getStats().getAlertsRaised() + raised);
    }

    Map<String, Set<BucketRange>> windows(StageContext context) {
        Job job = context.getJob();
        Set<String> entities = new LinkedHashSet<>(job.entities());
        if (entities.isEmpty()) {
            for (String sourceId : job.sourceIds()) {
                sourceRegistry.get(sourceId).definition().getEntities()
                        .forEach(e -> entities.add(e.trim().toUpperCase(Locale.ROOT)));
            }
            context.getRebuilt().forEach(b -> entities.add(b.getEntity()));
            context.getIngested().stream().map(MarketRecord::getEntity).forEach(entities::add);
        }
        Instant current = context.getTickTime().minusMillis(1);
        Map<String, Set<BucketRange>> windows = new LinkedHashMap<>();
        for (String entity : entities) {
            Set<BucketRange> ranges = new LinkedHashSet<>();
            for (AggregateBucket b : context.getRebuilt()) {
                if (b.getEntity().equals(entity)) {
                    ranges.add(new BucketRange(b.getGranularity(), b.getBucketStart()));
                }
            }
            for (BucketGranularity g : job.granularities()) {
                ranges.add(BucketRange.containing(g, current));
            }
            windows.put(entity, ranges);
        }
        return windows;
    }
}
