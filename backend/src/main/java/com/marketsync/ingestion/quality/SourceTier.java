package com.marketsync.ingestion.quality;

/**
 * Source reliability tier; multiplies the quality score of every record from the source.
 */
public enum SourceTier {
    HIGH(1.0),
    MEDIUM(0.9),
    LOW(0.75);

    private final double weight;

    SourceTier(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
