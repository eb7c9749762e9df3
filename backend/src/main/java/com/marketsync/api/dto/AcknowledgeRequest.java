package com.marketsync.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AcknowledgeRequest(@NotBlank(message = "INVALID_ACKNOWLEDGER") String acknowledgedBy) {
}
