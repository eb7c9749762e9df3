package com.marketsync.ingestion.quality;

import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.config.QualityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Deterministic record quality in [0, 1]:
 * <pre>
 *   score = tier × (0.55·volume + 0.25·plausibility + 0.20·completeness),  0 when price ≤ 0
 * </pre>
 * A record without volume therefore never reaches 0.5.
 */
@Component
@RequiredArgsConstructor
public class QualityScorer {

    static final double VOLUME_WEIGHT = 0.55;
    static final double PLAUSIBILITY_WEIGHT = 0.25;
    static final double COMPLETENESS_WEIGHT = 0.20;

    private static final BigDecimal TEN_MILLION = new BigDecimal("10000000");
    private static final BigDecimal ONE_MILLION = new BigDecimal("1000000");
    private static final BigDecimal HUNDRED_THOUSAND = new BigDecimal("100000");

    private final QualityProperties qualityProperties;

    public double score(MarketRecord record) {
        return score(record, ScoringContext.of(SourceTier.MEDIUM));
    }

    public double score(MarketRecord record, ScoringContext context) {
        if (record.getPrice() == null || record.getPrice().signum() <= 0) {
            return 0.0;
        }
        double raw = VOLUME_WEIGHT * volumeComponent(record.getVolume24h())
                + PLAUSIBILITY_WEIGHT * plausibilityComponent(record.getPrice(), context.referencePrice())
                + COMPLETENESS_WEIGHT * completenessComponent(record);
        double tier = context.tier() == null ? SourceTier.MEDIUM.weight() : context.tier().weight();
        return round(clamp(raw * tier));
    }

    public boolean isTrustworthy(MarketRecord record) {
        return record.getQualityScore() >= qualityProperties.getMinQualityScore();
    }

    public double minQualityScore() {
        return qualityProperties.getMinQualityScore();
    }

    static double volumeComponent(BigDecimal volume) {
        if (volume == null || volume.signum() <= 0) {
            return 0.0;
        }
        if (volume.compareTo(TEN_MILLION) > 0) {
            return 1.0;
        }
        if (volume.compareTo(ONE_MILLION) > 0) {
            return 0.9;
        }
        if (volume.compareTo(HUNDRED_THOUSAND) > 0) {
            return 0.8;
        }
        return 0.6;
    }

    double plausibilityComponent(BigDecimal price, BigDecimal referencePrice) {
        if (referencePrice == null || referencePrice.signum() <= 0) {
            return 1.0;
        }
        double deviation = price.subtract(referencePrice).abs()
                .divide(referencePrice, MathContext.DECIMAL64)
                .doubleValue();
        if (deviation <= qualityProperties.getPlausibleDeviation()) {
            return 1.0;
        }
        if (deviation <= qualityProperties.getImplausibleDeviation()) {
            return 0.5;
        }
        return 0.0;
    }

    static double completenessComponent(MarketRecord record) {
        int present = 0;
        if (record.getMarketCap() != null && record.getMarketCap().signum() > 0) {
            present++;
        }
        if (record.getPercentChange24h() != null) {
            present++;
        }
        return present / 2.0;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
