package com.marketsync.ingestion.store;

public enum UpsertOutcome {
    /** No row with this natural key existed. */
    INSERTED,
    /** Existing row replaced by a write with equal or newer observedAt. */
    UPDATED,
    /** Existing row already held the same payload. */
    UNCHANGED,
    /** Stored row is newer; the incoming write lost. */
    STALE
}
