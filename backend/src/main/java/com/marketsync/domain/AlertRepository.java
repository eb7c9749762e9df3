package com.marketsync.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Reads for alerts. Inserts go through AlertEngine so the dedup index is honored.
 */
public interface AlertRepository extends MongoRepository<Alert, String> {

    List<Alert> findByEntityOrderByCreatedAtDesc(String entity, Pageable pageable);

    List<Alert> findAllByOrderByCreatedAtDesc(Pageable pageable);

    boolean existsByDedupKey(String dedupKey);
}
