package com.marketsync.domain;

/**
 * Published after an alert is persisted; consumed by alert sinks.
 */
public record AlertRaisedEvent(Alert alert) {}
