package com.marketsync.api.controller;

import com.marketsync.api.dto.ModelMetricRequest;
import com.marketsync.api.dto.ModelMetricResponse;
import com.marketsync.domain.ModelPerformanceMetric;
import com.marketsync.drift.ModelMetricService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * POST /models/{id}/metrics: external evaluations feeding the drift check.
 */
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelMetricsController {

    private final ModelMetricService modelMetricService;
    private final Clock clock;

    @PostMapping("/{id}/metrics")
    public ResponseEntity<ModelMetricResponse> record(@PathVariable String id, @Valid @RequestBody ModelMetricRequest request) {
        ModelPerformanceMetric metric = modelMetricService.record(id, request.accuracy(), request.driftScore(),
                request.evaluatedAt() != null ? request.evaluatedAt() : clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(ModelMetricResponse.from(metric));
    }
}
