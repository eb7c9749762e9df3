package com.marketsync.alerting;

import com.marketsync.aggregation.BucketRange;
import com.marketsync.alerting.rule.AlertMetric;
import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.AggregateBucketRepository;
import com.marketsync.domain.Indicators;
import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.MarketRecordRepository;
import com.marketsync.ingestion.config.QualityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Computes metric values for one (entity, window). Bucket metrics read the stored bucket for the window; an
 * absent bucket or indicator yields no value and the rule is not evaluated.
 */
@Component
@RequiredArgsConstructor
public class AlertMetricResolver {

    private final AggregateBucketRepository aggregateBucketRepository;
    private final MarketRecordRepository marketRecordRepository;
    private final QualityProperties qualityProperties;
    private final Clock clock;

    public OptionalDouble resolve(AlertMetric metric, String entity, BucketRange window) {
        return switch (metric) {
            case PRICE_CHANGE_PCT -> bucket(entity, window)
                    .map(AggregateBucket::getPriceChangePct)
                    .map(OptionalDouble::of)
                    .orElse(OptionalDouble.empty());
            case VOLUME_CHANGE_PCT -> volumeChangePct(entity, window);
            case RSI -> bucket(entity, window)
                    .map(AggregateBucket::getIndicators)
                    .map(Indicators::getRsi14)
                    .map(OptionalDouble::of)
                    .orElse(OptionalDouble.empty());
            case COMPLETENESS -> bucket(entity, window)
                    .map(b -> OptionalDouble.of(b.getCompletenessScore()))
                    .orElse(OptionalDouble.empty());
            case STALENESS_MINUTES -> stalenessMinutes(entity, window);
            case LOW_QUALITY_COUNT -> OptionalDouble.of(lowQualityCount(entity, window));
            case BOLLINGER_BREAKOUT_PCT -> bucket(entity, window)
                    .map(AlertMetricResolver::bollingerBreakoutPct)
                    .orElse(OptionalDouble.empty());
        };
    }

    private Optional<AggregateBucket> bucket(String entity, BucketRange window) {
        return aggregateBucketRepository.findByEntityAndGranularityAndBucketStart(entity, window.granularity(), window.start());
    }

    private OptionalDouble volumeChangePct(String entity, BucketRange window) {
        Optional<AggregateBucket> current = bucket(entity, window);
        if (current.isEmpty() || current.get().getVolume() == null) {
            return OptionalDouble.empty();
        }
        List<AggregateBucket> previous = aggregateBucketRepository
                .findByEntityAndGranularityAndBucketStartLessThanOrderByBucketStartDesc(
                        entity, window.granularity(), window.start(), PageRequest.of(0, 1));
        if (previous.isEmpty() || previous.get(0).getVolume() == null || previous.get(0).getVolume().signum() == 0) {
            return OptionalDouble.empty();
        }
        BigDecimal before = previous.get(0).getVolume();
        return OptionalDouble.of(current.get().getVolume().subtract(before)
                .divide(before, MathContext.DECIMAL64).doubleValue() * 100.0);
    }

    /** Minutes between the latest stored record (any quality) and min(now, window end). */
    private OptionalDouble stalenessMinutes(String entity, BucketRange window) {
        Instant now = clock.instant();
        Instant reference = now.isBefore(window.end()) ? now : window.end();
        return marketRecordRepository.findFirstByEntityOrderByObservedAtDesc(entity)
                .map(MarketRecord::getObservedAt)
                .map(latest -> OptionalDouble.of(Math.max(0L, Duration.between(latest, reference).toSeconds()) / 60.0))
                .orElse(OptionalDouble.empty());
    }

    private long lowQualityCount(String entity, BucketRange window) {
        double min = qualityProperties.getMinQualityScore();
        return marketRecordRepository
                .findByEntityAndObservedAtGreaterThanEqualAndObservedAtLessThan(entity, window.start(), window.end())
                .stream()
                .filter(r -> r.getQualityScore() < min)
                .count();
    }

    static OptionalDouble bollingerBreakoutPct(AggregateBucket bucket) {
        Indicators ind = bucket.getIndicators();
        if (ind == null || ind.getBollingerUpper() == null || ind.getBollingerLower() == null || bucket.getClose() == null) {
            return OptionalDouble.empty();
        }
        double close = bucket.getClose().doubleValue();
        double upper = ind.getBollingerUpper();
        double lower = ind.getBollingerLower();
        if (close > upper && upper != 0.0) {
            return OptionalDouble.of((close - upper) / upper * 100.0);
        }
        if (close < lower && lower != 0.0) {
            return OptionalDouble.of((close - lower) / lower * 100.0);
        }
        return OptionalDouble.of(0.0);
    }
}
