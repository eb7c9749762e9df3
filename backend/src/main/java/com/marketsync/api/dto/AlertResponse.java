package com.marketsync.api.dto;

import com.marketsync.domain.Alert;

import java.time.Instant;

public record AlertResponse(
        String id,
        String ruleId,
        String type,
        String entity,
        String severity,
        double triggerValue,
        double threshold,
        Instant windowStart,
        Instant windowEnd,
        String message,
        Instant createdAt,
        boolean acknowledged
) {

    public static AlertResponse from(Alert a, boolean acknowledged) {
        return new AlertResponse(a.getId(), a.getRuleId(), a.getType(), a.getEntity(),
                a.getSeverity() != null ? a.getSeverity().name() : null,
                a.getTriggerValue(), a.getThreshold(), a.getWindowStart(), a.getWindowEnd(),
                a.getMessage(), a.getCreatedAt(), acknowledged);
    }
}
