package com.marketsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Reads for watermarks. Advancing goes through WatermarkStore (conditional update).
 */
public interface WatermarkRepository extends MongoRepository<Watermark, String> {

    Optional<Watermark> findByJobIdAndSourceId(String jobId, String sourceId);

    List<Watermark> findByJobId(String jobId);
}
