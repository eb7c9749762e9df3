package com.marketsync.api.dto;

import com.marketsync.domain.ModelPerformanceMetric;

import java.time.Instant;

public record ModelMetricResponse(String id, String modelId, double accuracy, double driftScore, Instant evaluatedAt) {

    public static ModelMetricResponse from(ModelPerformanceMetric m) {
        return new ModelMetricResponse(m.getId(), m.getModelId(), m.getAccuracy(), m.getDriftScore(), m.getEvaluatedAt());
    }
}
