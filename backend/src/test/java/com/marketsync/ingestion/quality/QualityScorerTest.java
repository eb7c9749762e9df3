package com.marketsync.ingestion.quality;

import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.config.QualityProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityScorerTest {

    private final QualityScorer scorer = new QualityScorer(new QualityProperties());

    private static MarketRecord record(String price, String volume, String marketCap, String change) {
        MarketRecord r = new MarketRecord();
        r.setEntity("BTC");
        r.setPrice(price == null ? null : new BigDecimal(price));
        r.setVolume24h(volume == null ? null : new BigDecimal(volume));
        r.setMarketCap(marketCap == null ? null : new BigDecimal(marketCap));
        r.setPercentChange24h(change == null ? null : new BigDecimal(change));
        return r;
    }

    @Test
    @DisplayName("complete high-volume record from a HIGH tier source scores 1.0")
    void fullScore() {
        MarketRecord r = record("64000", "25000000", "1200000000000", "1.5");

        assertThat(scorer.score(r, ScoringContext.of(SourceTier.HIGH))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("zero volume always scores below 0.5")
    void zeroVolumeBelowHalf() {
        MarketRecord r = record("64000", "0", "1200000000000", "1.5");

        assertThat(scorer.score(r, ScoringContext.of(SourceTier.HIGH))).isLessThan(0.5);
        assertThat(scorer.score(r)).isLessThan(0.5);
    }

    @Test
    @DisplayName("non-positive price scores 0")
    void nonPositivePrice() {
        assertThat(scorer.score(record("0", "25000000", null, null))).isEqualTo(0.0);
        assertThat(scorer.score(record(null, "25000000", null, null))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("tier weight scales the score")
    void tierWeight() {
        MarketRecord r = record("64000", "500000", null, null);

        // 0.55 * 0.8 + 0.25 * 1.0 + 0.20 * 0 = 0.69
        assertThat(scorer.score(r, ScoringContext.of(SourceTier.HIGH))).isCloseTo(0.69, within(1e-9));
        assertThat(scorer.score(r, ScoringContext.of(SourceTier.MEDIUM))).isCloseTo(0.621, within(1e-9));
        assertThat(scorer.score(r, ScoringContext.of(SourceTier.LOW))).isCloseTo(0.5175, within(1e-3));
    }

    @Test
    @DisplayName("price far from the reference loses the plausibility component")
    void implausiblePrice() {
        MarketRecord r = record("64000", "25000000", "1200000000000", "1.5");

        double near = scorer.score(r, new ScoringContext(SourceTier.HIGH, new BigDecimal("63000")));
        double moderate = scorer.score(r, new ScoringContext(SourceTier.HIGH, new BigDecimal("48000")));
        double far = scorer.score(r, new ScoringContext(SourceTier.HIGH, new BigDecimal("20000")));

        assertThat(near).isEqualTo(1.0);
        assertThat(moderate).isCloseTo(0.875, within(1e-9));
        assertThat(far).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void isTrustworthy_usesMinQualityScore() {
        MarketRecord r = new MarketRecord();
        r.setQualityScore(0.6);
        assertThat(scorer.isTrustworthy(r)).isTrue();
        r.setQualityScore(0.5999);
        assertThat(scorer.isTrustworthy(r)).isFalse();
    }

    @Test
    void volumeComponent_bands() {
        assertThat(QualityScorer.volumeComponent(null)).isEqualTo(0.0);
        assertThat(QualityScorer.volumeComponent(new BigDecimal("50000"))).isEqualTo(0.6);
        assertThat(QualityScorer.volumeComponent(new BigDecimal("200000"))).isEqualTo(0.8);
        assertThat(QualityScorer.volumeComponent(new BigDecimal("2000000"))).isEqualTo(0.9);
        assertThat(QualityScorer.volumeComponent(new BigDecimal("20000000"))).isEqualTo(1.0);
    }
}
