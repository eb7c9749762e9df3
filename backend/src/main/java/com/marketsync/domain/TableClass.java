package com.marketsync.domain;

/**
 * Collections subject to retention, with the timestamp field that decides age and the entity field (if any).
 */
public enum TableClass {
    RAW_RECORDS("market_records", "observedAt", "entity"),
    AGGREGATES("aggregate_buckets", "bucketStart", "entity"),
    ALERTS("alerts", "createdAt", "entity"),
    JOB_RUNS("job_runs", "tickTime", null),
    MODEL_METRICS("model_metrics", "evaluatedAt", null);

    private final String collection;
    private final String timestampField;
    private final String entityField;

    TableClass(String collection, String timestampField, String entityField) {
        this.collection = collection;
        this.timestampField = timestampField;
        this.entityField = entityField;
    }

    public String collection() {
        return collection;
    }

    public String timestampField() {
        return timestampField;
    }

    public String entityField() {
        return entityField;
    }
}
