package com.marketsync.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ModelPerformanceMetricRepository extends MongoRepository<ModelPerformanceMetric, String> {

    /** Newest first; the first element is the latest metric, the rest form the baseline. */
    List<ModelPerformanceMetric> findByModelIdOrderByEvaluatedAtDesc(String modelId, Pageable pageable);
}
