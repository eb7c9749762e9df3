package com.marketsync.aggregation;

import com.marketsync.domain.BucketGranularity;

import java.time.Instant;

/**
 * Half-open bucket window [start, end) aligned to its granularity.
 */
public record BucketRange(BucketGranularity granularity, Instant start) {

    public static BucketRange containing(BucketGranularity granularity, Instant instant) {
        return new BucketRange(granularity, granularity.bucketStart(instant));
    }

    public Instant end() {
        return start.plus(granularity.length());
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end());
    }
}
