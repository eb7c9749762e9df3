package com.marketsync.scheduler;

import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.RunStats;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one run shared by its stages. Watermark candidates are only staged here; the runner commits them after
 * the last stage succeeded.
 */
@Getter
public class StageContext {

    private final Job job;
    private final Instant tickTime;
    private final Instant deadline;
    private final Clock clock;
    private final RunStats stats = new RunStats();
    private final Map<String, Instant> pendingWatermarks = new LinkedHashMap<>();
    private final List<MarketRecord> ingested = new ArrayList<>();
    private final List<AggregateBucket> rebuilt = new ArrayList<>();

    public StageContext(Job job, Instant tickTime, Instant deadline, Clock clock) {
        this.job = job;
        this.tickTime = tickTime;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * @throws DeadlineExceededException once the run's deadline has passed
     */
    public void checkDeadline() {
        if (clock.instant().isAfter(deadline)) {
            throw new DeadlineExceededException("deadline exceeded");
        }
    }

    public void stageWatermark(String sourceId, Instant candidate) {
        if (candidate != null) {
            pendingWatermarks.merge(sourceId, candidate, (a, b) -> a.isAfter(b) ? a : b);
        }
    }

    public void addIngested(List<MarketRecord> records) {
        ingested.addAll(records);
    }

    public void addRebuilt(AggregateBucket bucket) {
        rebuilt.add(bucket);
    }

    public Map<String, Instant> getPendingWatermarks() {
        return Collections.unmodifiableMap(pendingWatermarks);
    }

    public List<MarketRecord> getIngested() {
        return Collections.unmodifiableList(ingested);
    }

    public List<AggregateBucket> getRebuilt() {
        return Collections.unmodifiableList(rebuilt);
    }
}
