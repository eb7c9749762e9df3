package com.marketsync.api.dto;

import java.time.Instant;

public record AcknowledgeResponse(String alertId, String acknowledgedBy, Instant acknowledgedAt) {
}
