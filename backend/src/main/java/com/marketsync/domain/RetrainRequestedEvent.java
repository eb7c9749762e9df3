package com.marketsync.domain;

/**
 * Published after a retrain request is persisted.
 */
public record RetrainRequestedEvent(RetrainRequest request) {}
