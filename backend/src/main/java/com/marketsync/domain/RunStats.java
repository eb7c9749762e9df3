package com.marketsync.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-run sync statistics persisted on the JobRun.
 */
@NoArgsConstructor
@Getter
@Setter
public class RunStats {

    private int recordsFetched;
    private int recordsStored;
    private int recordsRejected;
    private int recordsBelowQuality;
    private Double avgQualityScore;
    private int bucketsRebuilt;
    private int alertsRaised;
    private int metricsRecorded;
    private int retrainRequests;
    private long archived;
    private long deleted;
}
