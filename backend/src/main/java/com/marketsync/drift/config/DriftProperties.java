package com.marketsync.drift.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retrain thresholds (marketsync.drift.*). Defaults follow the monitoring ladder: accuracy below 0.7 or drift above
 * 0.1 needs attention.
 */
@ConfigurationProperties(prefix = "marketsync.drift")
@NoArgsConstructor
@Getter
@Setter
public class DriftProperties {

    /** Number of metrics before the latest that form the rolling baseline. */
    private int baselineSize = 10;
    private double minAccuracy = 0.7;
    private double maxDrift = 0.1;
    /** Tolerated accuracy drop of the latest metric below the baseline mean. */
    private double maxAccuracyDrop = 0.05;
    /** Daily buckets handed to the forecaster per entity. */
    private int forecastHistoryBuckets = 30;
}
