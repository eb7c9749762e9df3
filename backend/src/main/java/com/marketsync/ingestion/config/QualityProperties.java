package com.marketsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Quality gate. Records scoring below minQualityScore are stored for audit but never aggregated or alerted on.
 */
@ConfigurationProperties(prefix = "marketsync.quality")
@NoArgsConstructor
@Getter
@Setter
public class QualityProperties {

    private double minQualityScore = 0.6;

    /** Price deviation from the reference price still considered fully plausible. */
    private double plausibleDeviation = 0.2;

    /** Deviation beyond which the price is considered implausible (score component 0). */
    private double implausibleDeviation = 0.5;
}
