package com.marketsync.ingestion.source;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Item as returned by an upstream collaborator. symbol + timestamp identify it within the source.
 * The timestamp is truncated to milliseconds, the precision of stored dates, so a watermark read back from the
 * store compares equal to the item it was taken from.
 */
public record RawItem(
        String symbol,
        Instant timestamp,
        BigDecimal price,
        BigDecimal volume24h,
        BigDecimal marketCap,
        BigDecimal percentChange24h,
        Map<String, Object> attributes
) {

    public RawItem {
        if (timestamp != null) {
            timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
        }
    }

    public static RawItem of(String symbol, Instant timestamp, BigDecimal price, BigDecimal volume24h) {
        return new RawItem(symbol, timestamp, price, volume24h, null, null, Map.of());
    }
}
