package com.marketsync.ingestion.quality;

import java.math.BigDecimal;

/**
 * Inputs to scoring beyond the record itself. referencePrice is the latest trustworthy price for the entity
 * (null when the entity has no history yet).
 */
public record ScoringContext(SourceTier tier, BigDecimal referencePrice) {

    public static ScoringContext of(SourceTier tier) {
        return new ScoringContext(tier, null);
    }
}
