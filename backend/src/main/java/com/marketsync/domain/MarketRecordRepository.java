package com.marketsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for market_records. Writes go through IdempotentRecordStore; this interface is for reads.
 */
public interface MarketRecordRepository extends MongoRepository<MarketRecord, String> {

    Optional<MarketRecord> findByNaturalKey(String naturalKey);

    /** Qualifying records in [from, to) ordered by observation time (aggregation input). */
    List<MarketRecord> findByEntityAndQualityScoreGreaterThanEqualAndObservedAtGreaterThanEqualAndObservedAtLessThanOrderByObservedAtAsc(
            String entity, double minQualityScore, Instant from, Instant to);

    List<MarketRecord> findByEntityAndObservedAtGreaterThanEqualAndObservedAtLessThan(String entity, Instant from, Instant to);

    Optional<MarketRecord> findFirstByEntityAndQualityScoreGreaterThanEqualOrderByObservedAtDesc(String entity, double minQualityScore);

    Optional<MarketRecord> findFirstByEntityOrderByObservedAtDesc(String entity);

    boolean existsByEntityInAndObservedAtGreaterThanEqual(List<String> entities, Instant since);
}
