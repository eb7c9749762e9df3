package com.marketsync.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Accuracy and prediction drift of a model at one evaluation. Produced by the forecaster or posted by API.
 */
@Document(collection = "model_metrics")
@CompoundIndex(name = "model_evaluated", def = "{'modelId': 1, 'evaluatedAt': -1}")
@NoArgsConstructor
@Getter
@Setter
public class ModelPerformanceMetric {

    @Id
    private String id;
    private String modelId;
    private double accuracy;
    private double driftScore;
    private Instant evaluatedAt;
}
