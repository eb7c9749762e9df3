package com.marketsync.drift;

import com.marketsync.domain.ModelPerformanceMetric;
import com.marketsync.domain.ModelPerformanceMetricRepository;
import com.marketsync.ingestion.store.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ModelMetricService {

    private final ModelPerformanceMetricRepository metricRepository;

    public ModelPerformanceMetric record(String modelId, double accuracy, double driftScore, Instant evaluatedAt) {
        if (accuracy < 0.0 || accuracy > 1.0) {
            throw new IllegalArgumentException("accuracy must be in [0, 1]: " + accuracy);
        }
        if (driftScore < 0.0) {
            throw new IllegalArgumentException("driftScore must not be negative: " + driftScore);
        }
        ModelPerformanceMetric m = new ModelPerformanceMetric();
        m.setModelId(modelId);
        m.setAccuracy(accuracy);
        m.setDriftScore(driftScore);
        m.setEvaluatedAt(evaluatedAt);
        try {
            ModelPerformanceMetric saved = metricRepository.save(m);
            log.debug("Metric for {}: accuracy={} drift={}", modelId, accuracy, driftScore);
            return saved;
        } catch (DataAccessException e) {
            throw new StorageException("Cannot store metric for model " + modelId, e);
        }
    }

    public List<ModelPerformanceMetric> latest(String modelId, int limit) {
        return metricRepository.findByModelIdOrderByEvaluatedAtDesc(modelId, PageRequest.of(0, Math.max(1, limit)));
    }
}
