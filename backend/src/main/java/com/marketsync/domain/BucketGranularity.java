package com.marketsync.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Fixed time bucket sizes for aggregation. Buckets are aligned to UTC hour/day boundaries.
 */
public enum BucketGranularity {
    HOURLY(Duration.ofHours(1), ChronoUnit.HOURS),
    DAILY(Duration.ofDays(1), ChronoUnit.DAYS);

    private final Duration length;
    private final ChronoUnit unit;

    BucketGranularity(Duration length, ChronoUnit unit) {
        this.length = length;
        this.unit = unit;
    }

    public Duration length() {
        return length;
    }

    /** Start of the bucket containing {@code instant}. */
    public Instant bucketStart(Instant instant) {
        return instant.truncatedTo(unit);
    }
}
