package com.marketsync.ingestion.source;

import com.marketsync.domain.MarketRecord;

import java.time.Instant;
import java.util.List;

/**
 * Records strictly newer than the input watermark, de-duplicated by natural key, plus the watermark
 * candidate (max observedAt, or the input watermark when nothing new arrived) and the rejected-item count.
 */
public record FetchResult(String sourceId, List<MarketRecord> records, Instant newWatermark, int rejected) {

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
