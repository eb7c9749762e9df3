package com.marketsync.api.dto;

public record TriggerResponse(String jobId, String message) {
}
