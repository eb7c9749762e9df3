package com.marketsync.aggregation;

import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.AggregateBucketRepository;
import com.marketsync.domain.BucketGranularity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class AggregateQueryService {

    private final AggregateBucketRepository aggregateBucketRepository;

    /** Buckets starting in [from, to), oldest first. */
    public List<AggregateBucket> buckets(String entity, BucketGranularity granularity, Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return aggregateBucketRepository
                .findByEntityAndGranularityAndBucketStartGreaterThanEqualAndBucketStartLessThanOrderByBucketStartAsc(
                        entity.trim().toUpperCase(Locale.ROOT), granularity, from, to);
    }
}
