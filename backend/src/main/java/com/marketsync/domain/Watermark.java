package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * High-water mark per (jobId, sourceId): all source data observed at or before lastSeenTimestamp is ingested.
 * Single source of truth for ingestion progress; never derived from market_records.
 */
@Document(collection = "watermarks")
@CompoundIndex(name = "job_source", def = "{'jobId': 1, 'sourceId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Watermark {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String jobId;
    private String sourceId;
    private Instant lastSeenTimestamp;
    private Instant updatedAt;
}
