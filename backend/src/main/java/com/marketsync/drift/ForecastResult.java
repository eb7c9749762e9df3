package com.marketsync.drift;

/**
 * Output of one forecaster call. accuracy and driftScore describe the model's recent performance on the entity.
 */
public record ForecastResult(double prediction, double confidence, double accuracy, double driftScore) {
}
