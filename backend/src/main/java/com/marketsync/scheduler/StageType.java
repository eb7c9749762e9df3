package com.marketsync.scheduler;

public enum StageType {
    INGEST,
    AGGREGATE,
    ALERT,
    FORECAST,
    DRIFT_CHECK,
    RETENTION
}
