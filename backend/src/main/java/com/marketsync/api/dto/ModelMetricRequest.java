package com.marketsync.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * evaluatedAt defaults to the receive time.
 */
public record ModelMetricRequest(
        @NotNull(message = "INVALID_ACCURACY") @DecimalMin(value = "0.0", message = "INVALID_ACCURACY")
        @DecimalMax(value = "1.0", message = "INVALID_ACCURACY") Double accuracy,
        @NotNull(message = "INVALID_DRIFT") @DecimalMin(value = "0.0", message = "INVALID_DRIFT") Double driftScore,
        Instant evaluatedAt
) {
}
