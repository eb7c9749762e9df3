package com.marketsync.scheduler.stage;

import com.marketsync.aggregation.BucketAggregator;
import com.marketsync.aggregation.BucketRange;
import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.MarketRecord;
import com.marketsync.scheduler.GuardType;
import com.marketsync.scheduler.Job;
import com.marketsync.scheduler.JobSchedule;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregateStageTest {

    private static final Instant TICK = Instant.parse("2025-03-01T11:00:00Z");
    private static final BucketRange H10 = new BucketRange(BucketGranularity.HOURLY, Instant.parse("2025-03-01T10:00:00Z"));

    @Mock
    BucketAggregator bucketAggregator;

    @InjectMocks
    AggregateStage aggregateStage;

    private static Job job(List<StageType> stages, List<String> entities, List<BucketGranularity> granularities,
                           Duration interval) {
        return new Job("job", true, new JobSchedule(interval, Instant.EPOCH, null), GuardType.ALWAYS, stages,
                List.of("cmc"), entities, granularities, List.of(), List.of(), List.of(), null);
    }

    private static StageContext context(Job job) {
        return new StageContext(job, TICK, TICK.plus(Duration.ofMinutes(5)), Clock.fixed(TICK, ZoneOffset.UTC));
    }

    private static MarketRecord record(String entity, String observedAt) {
        MarketRecord r = new MarketRecord();
        r.setEntity(entity);
        r.setObservedAt(Instant.parse(observedAt));
        return r;
    }

    @Test
    @DisplayName("after ingest only the buckets touched by ingested records of the job's entities are rebuilt")
    void rebuildsTouchedBuckets() {
        Job job = job(List.of(StageType.INGEST, StageType.AGGREGATE), List.of("BTC"), List.of(BucketGranularity.HOURLY),
                Duration.ofMinutes(3));
        StageContext ctx = context(job);
        ctx.addIngested(List.of(record("BTC", "2025-03-01T10:15:00Z"), record("BTC", "2025-03-01T10:45:00Z"),
                record("DOGE", "2025-03-01T10:30:00Z")));
        AggregateBucket bucket = new AggregateBucket();
        bucket.setEntity("BTC");
        when(bucketAggregator.rebuild("BTC", H10)).thenReturn(Optional.of(bucket));

        aggregateStage.execute(ctx);

        assertThat(ctx.getRebuilt()).containsExactly(bucket);
        assertThat(ctx.getStats().getBucketsRebuilt()).isEqualTo(1);
        verify(bucketAggregator).rebuild(eq("BTC"), any());
    }

    @Test
    @DisplayName("a backfilled bucket triggers an indicator refresh of the stored buckets after it")
    void backfill_refreshesFollowers() {
        Job job = job(List.of(StageType.INGEST, StageType.AGGREGATE), List.of(), List.of(BucketGranularity.HOURLY),
                Duration.ofMinutes(3));
        StageContext ctx = context(job);
        ctx.addIngested(List.of(record("BTC", "2025-03-01T05:30:00Z")));
        BucketRange h05 = new BucketRange(BucketGranularity.HOURLY, Instant.parse("2025-03-01T05:00:00Z"));
        AggregateBucket bucket = new AggregateBucket();
        bucket.setEntity("BTC");
        when(bucketAggregator.rebuild("BTC", h05)).thenReturn(Optional.of(bucket));
        when(bucketAggregator.refreshFollowing(eq("BTC"), eq(Set.of(h05)), any()))
                .thenReturn(List.of(new AggregateBucket(), new AggregateBucket()));

        aggregateStage.execute(ctx);

        assertThat(ctx.getRebuilt()).containsExactly(bucket);
        assertThat(ctx.getStats().getBucketsRebuilt()).isEqualTo(3);
    }

    @Test
    void nothingRebuilt_noRefresh() {
        Job job = job(List.of(StageType.INGEST, StageType.AGGREGATE), List.of(), List.of(BucketGranularity.HOURLY),
                Duration.ofMinutes(3));
        StageContext ctx = context(job);
        ctx.addIngested(List.of(record("BTC", "2025-03-01T10:30:00Z")));
        when(bucketAggregator.rebuild("BTC", H10)).thenReturn(Optional.empty());

        aggregateStage.execute(ctx);

        verify(bucketAggregator, never()).refreshFollowing(any(), any(), any());
        assertThat(ctx.getStats().getBucketsRebuilt()).isZero();
    }

    @Test
    @DisplayName("a job without ingest covers every bucket overlapping its last interval")
    void coveringLastInterval_spansBuckets() {
        Job job = job(List.of(StageType.AGGREGATE), List.of("BTC", "ETH"),
                List.of(BucketGranularity.HOURLY, BucketGranularity.DAILY), Duration.ofMinutes(90));

        Map<String, Set<BucketRange>> work = AggregateStage.coveringLastInterval(job, TICK);

        assertThat(work).containsOnlyKeys("BTC", "ETH");
        assertThat(work.get("BTC")).containsExactly(
                new BucketRange(BucketGranularity.HOURLY, Instant.parse("2025-03-01T09:00:00Z")),
                H10,
                new BucketRange(BucketGranularity.DAILY, Instant.parse("2025-03-01T00:00:00Z")));
    }
}
