package com.marketsync.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for aggregate_buckets keyed by (entity, granularity, bucketStart).
 */
public interface AggregateBucketRepository extends MongoRepository<AggregateBucket, String> {

    Optional<AggregateBucket> findByEntityAndGranularityAndBucketStart(String entity, BucketGranularity granularity, Instant bucketStart);

    /** Lookback for indicators: buckets strictly before {@code before}, newest first. */
    List<AggregateBucket> findByEntityAndGranularityAndBucketStartLessThanOrderByBucketStartDesc(
            String entity, BucketGranularity granularity, Instant before, Pageable pageable);

    /** Buckets strictly after {@code after}, oldest first: those whose indicator history includes it. */
    List<AggregateBucket> findByEntityAndGranularityAndBucketStartGreaterThanOrderByBucketStartAsc(
            String entity, BucketGranularity granularity, Instant after, Pageable pageable);

    List<AggregateBucket> findByEntityAndGranularityAndBucketStartGreaterThanEqualAndBucketStartLessThanOrderByBucketStartAsc(
            String entity, BucketGranularity granularity, Instant from, Instant to);
}
