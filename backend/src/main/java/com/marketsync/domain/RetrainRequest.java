package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Request to retrain a model whose latest metric breached accuracy or drift thresholds.
 * deficit is the largest normalized shortfall and orders the retraining queue.
 */
@Document(collection = "retrain_requests")
@CompoundIndex(name = "model_status", def = "{'modelId': 1, 'status': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RetrainRequest {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String modelId;
    private String reason;
    private double deficit;
    private Severity priority;
    private double latestAccuracy;
    private Double baselineAccuracy;
    private double driftScore;
    private RetrainStatus status;
    private Instant requestedAt;

    public enum RetrainStatus {
        PENDING,
        ACCEPTED,
        COMPLETED
    }
}
