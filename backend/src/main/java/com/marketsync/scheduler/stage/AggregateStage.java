package com.marketsync.scheduler.stage;

import com.marketsync.aggregation.BucketAggregator;
import com.marketsync.aggregation.BucketRange;
import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.MarketRecord;
import com.marketsync.scheduler.Job;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds every bucket touched by this run's records. A job that does not ingest rebuilds the buckets covering
 * its last interval for its entities. Stored buckets after a rebuilt one get their indicators refreshed, so a
 * backfilled record reaches the later series.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AggregateStage implements PipelineStage {

    private final BucketAggregator bucketAggregator;

    @Override
    public StageType type() {
        return StageType.AGGREGATE;
    }

    @Override
    public void execute(StageContext context) {
        Map<String, Set<BucketRange>> work = context.getJob().stages().contains(StageType.INGEST)
                ? touchedByIngest(context)
                : coveringLastInterval(context.getJob(), context.getTickTime());
        int rebuilt = 0;
        int refreshed = 0;
        for (Map.Entry<String, Set<BucketRange>> e : work.entrySet()) {
            Set<BucketRange> done = new LinkedHashSet<>();
            for (BucketRange range : e.getValue()) {
                context.checkDeadline();
                Optional<AggregateBucket> bucket = bucketAggregator.rebuild(e.getKey(), range);
                if (bucket.isPresent()) {
                    context.addRebuilt(bucket.get());
                    done.add(range);
                    rebuilt++;
                }
            }
            if (!done.isEmpty()) {
                refreshed += bucketAggregator.refreshFollowing(e.getKey(), done, context::checkDeadline).size();
            }
        }
        context.getStats().setBucketsRebuilt(context.getStats().getBucketsRebuilt() + rebuilt + refreshed);
        log.debug("Job {} rebuilt {} bucket(s), refreshed indicators of {}", context.getJob().id(), rebuilt, refreshed);
    }

    private static Map<String, Set<BucketRange>> touchedByIngest(StageContext context) {
        Job job = context.getJob();
        Map<String, List<MarketRecord>> byEntity = new LinkedHashMap<>();
        for (MarketRecord r : context.getIngested()) {
            if (job.entities().isEmpty() || job.entities().contains(r.getEntity())) {
                byEntity.computeIfAbsent(r.getEntity(), k -> new ArrayList<>()).add(r);
            }
        }
        Map<String, Set<BucketRange>> work = new LinkedHashMap<>();
        byEntity.forEach((entity, records) ->
                work.put(entity, BucketAggregator.touchedRanges(records, job.granularities())));
        return work;
    }

    static Map<String, Set<BucketRange>> coveringLastInterval(Job job, Instant tickTime) {
        Instant from = tickTime.minus(job.interval());
        Map<String, Set<BucketRange>> work = new LinkedHashMap<>();
        for (String entity : job.entities()) {
            Set<BucketRange> ranges = new LinkedHashSet<>();
            for (BucketGranularity g : job.granularities()) {
                BucketRange range = BucketRange.containing(g, from);
                while (range.start().isBefore(tickTime)) {
                    ranges.add(range);
                    range = new BucketRange(g, range.end());
                }
            }
            work.put(entity, ranges);
        }
        return work;
    }
}
