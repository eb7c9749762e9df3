package com.marketsync.scheduler;

/**
 * Cheap "is there work?" check evaluated before any stage runs.
 */
public enum GuardType {
    ALWAYS,
    /** Any of the job's sources reports an item newer than its watermark. */
    NEW_SOURCE_DATA,
    /** The store holds records for the job's entities observed within the last interval. */
    RECENT_RECORDS
}
