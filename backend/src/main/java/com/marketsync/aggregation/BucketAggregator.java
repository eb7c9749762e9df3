package com.marketsync.aggregation;

import com.marketsync.aggregation.config.AggregationProperties;
import com.marketsync.common.KeyedLocks;
import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.AggregateBucketRepository;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.Indicators;
import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.MarketRecordRepository;
import com.marketsync.ingestion.config.QualityProperties;
import com.marketsync.ingestion.store.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rebuilds OHLC buckets from all qualifying stored records in range; never patches a stored bucket.
 * Rebuilds of the same bucket key are serialized in-process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BucketAggregator {

    private static final Duration DAY = Duration.ofDays(1);

    private final MarketRecordRepository marketRecordRepository;
    private final AggregateBucketRepository aggregateBucketRepository;
    private final QualityProperties qualityProperties;
    private final AggregationProperties aggregationProperties;
    private final Clock clock;
    private final KeyedLocks bucketLocks = new KeyedLocks();

    /**
     * Recomputes the bucket for {@code entity} in {@code range} and persists it.
     *
     * @return empty when no qualifying record falls in the range (nothing is written or removed)
     */
    public Optional<AggregateBucket> rebuild(String entity, BucketRange range) {
        String key = entity + "|" + range.granularity() + "|" + range.start();
        return bucketLocks.withLock(key, () -> {
            try {
                List<MarketRecord> records = marketRecordRepository
                        .findByEntityAndQualityScoreGreaterThanEqualAndObservedAtGreaterThanEqualAndObservedAtLessThanOrderByObservedAtAsc(
                                entity, qualityProperties.getMinQualityScore(), range.start(), range.end());
                if (records.isEmpty()) {
                    return Optional.<AggregateBucket>empty();
                }
                List<AggregateBucket> history = previousBuckets(entity, range);
                AggregateBucket bucket = compute(entity, range, records, history).orElseThrow();
                bucket.setRebuiltAt(clock.instant());
                aggregateBucketRepository.findByEntityAndGranularityAndBucketStart(entity, range.granularity(), range.start())
                        .ifPresent(existing -> bucket.setId(existing.getId()));
                AggregateBucket saved = aggregateBucketRepository.save(bucket);
                log.debug("Rebuilt {} from {} record(s)", saved.bucketKey(), records.size());
                return Optional.of(saved);
            } catch (DataAccessException e) {
                throw new StorageException("Cannot rebuild bucket " + key, e);
            }
        });
    }

    /**
     * Recomputes the indicators of stored buckets that follow the rebuilt ones within the lookback, oldest first, so
     * a backfilled bucket's close reaches every later series that reads it. OHLC of the followers is left as stored.
     * Rebuilt ranges themselves are skipped.
     *
     * @param beforeEach invoked before each follower (deadline checks)
     * @return the refreshed buckets in time order
     */
    public List<AggregateBucket> refreshFollowing(String entity, Collection<BucketRange> rebuilt, Runnable beforeEach) {
        int lookback = Math.max(1, aggregationProperties.getLookbackBuckets());
        Map<BucketGranularity, TreeMap<Instant, AggregateBucket>> followers = new EnumMap<>(BucketGranularity.class);
        try {
            for (BucketRange range : rebuilt) {
                TreeMap<Instant, AggregateBucket> byStart =
                        followers.computeIfAbsent(range.granularity(), g -> new TreeMap<>());
                aggregateBucketRepository.findByEntityAndGranularityAndBucketStartGreaterThanOrderByBucketStartAsc(
                                entity, range.granularity(), range.start(), PageRequest.of(0, lookback))
                        .forEach(b -> byStart.putIfAbsent(b.getBucketStart(), b));
            }
        } catch (DataAccessException e) {
            throw new StorageException("Cannot load buckets following a rebuild of " + entity, e);
        }
        List<AggregateBucket> refreshed = new ArrayList<>();
        for (TreeMap<Instant, AggregateBucket> byStart : followers.values()) {
            for (AggregateBucket follower : byStart.values()) {
                BucketRange range = new BucketRange(follower.getGranularity(), follower.getBucketStart());
                if (rebuilt.contains(range)) {
                    continue;
                }
                beforeEach.run();
                refreshIndicators(entity, range).ifPresent(refreshed::add);
            }
        }
        if (!refreshed.isEmpty()) {
            log.debug("Refreshed indicators of {} bucket(s) following a rebuild of {}", refreshed.size(), entity);
        }
        return refreshed;
    }

    /** Empty when the bucket was removed (retention) between listing and refresh. */
    private Optional<AggregateBucket> refreshIndicators(String entity, BucketRange range) {
        String key = entity + "|" + range.granularity() + "|" + range.start();
        return bucketLocks.withLock(key, () -> {
            try {
                Optional<AggregateBucket> stored = aggregateBucketRepository
                        .findByEntityAndGranularityAndBucketStart(entity, range.granularity(), range.start());
                if (stored.isEmpty()) {
                    return Optional.<AggregateBucket>empty();
                }
                AggregateBucket bucket = stored.get();
                bucket.setIndicators(indicators(previousBuckets(entity, range), bucket));
                bucket.setRebuiltAt(clock.instant());
                return Optional.of(aggregateBucketRepository.save(bucket));
            } catch (DataAccessException e) {
                throw new StorageException("Cannot refresh indicators of " + key, e);
            }
        });
    }

    /**
     * Distinct buckets touched by the given records, in time order.
     */
    public static Set<BucketRange> touchedRanges(Collection<MarketRecord> records, Collection<BucketGranularity> granularities) {
        List<BucketRange> ranges = new ArrayList<>();
        for (BucketGranularity granularity : granularities) {
            for (MarketRecord r : records) {
                ranges.add(BucketRange.containing(granularity, r.getObservedAt()));
            }
        }
        ranges.sort(Comparator.comparing(BucketRange::start).thenComparing(BucketRange::granularity));
        return new LinkedHashSet<>(ranges);
    }

    /**
     * Pure OHLC + indicator computation. {@code records} must be ordered by observedAt and already quality-filtered;
     * {@code history} holds earlier buckets of the same granularity, oldest first.
     */
    static Optional<AggregateBucket> compute(String entity, BucketRange range, List<MarketRecord> records,
                                             List<AggregateBucket> history) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        AggregateBucket b = new AggregateBucket();
        b.setEntity(entity);
        b.setGranularity(range.granularity());
        b.setBucketStart(range.start());
        b.setBucketEnd(range.end());

        BigDecimal open = records.get(0).getPrice();
        BigDecimal close = records.get(records.size() - 1).getPrice();
        BigDecimal high = open;
        BigDecimal low = open;
        BigDecimal volumeSum = BigDecimal.ZERO;
        int volumeCount = 0;
        double qualitySum = 0.0;
        Set<String> sources = new LinkedHashSet<>();
        for (MarketRecord r : records) {
            high = high.max(r.getPrice());
            low = low.min(r.getPrice());
            if (r.getVolume24h() != null) {
                volumeSum = volumeSum.add(r.getVolume24h());
                volumeCount++;
            }
            qualitySum += r.getQualityScore();
            sources.add(r.getSource());
        }
        b.setOpen(open);
        b.setHigh(high);
        b.setLow(low);
        b.setClose(close);
        b.setVolume(scaledVolume(volumeSum, volumeCount, range));
        b.setPriceChangePct(open.signum() == 0 ? null
                : close.subtract(open).divide(open, MathContext.DECIMAL64).doubleValue() * 100.0);
        b.setContributingRecordCount(records.size());
        b.setCompletenessScore(qualitySum / records.size());
        b.setSources(new ArrayList<>(sources));
        b.setIndicators(indicators(history, b));
        return Optional.of(b);
    }

    /** Mean 24h volume scaled to the bucket length (hourly = 1/24 of the daily figure). */
    private static BigDecimal scaledVolume(BigDecimal sum, int count, BucketRange range) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal mean = sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
        BigDecimal fraction = BigDecimal.valueOf(range.granularity().length().toSeconds())
                .divide(BigDecimal.valueOf(DAY.toSeconds()), MathContext.DECIMAL64);
        return mean.multiply(fraction).setScale(8, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    static Indicators indicators(List<AggregateBucket> history, AggregateBucket current) {
        int n = history.size() + 1;
        double[] closes = new double[n];
        double[] highs = new double[n];
        double[] lows = new double[n];
        for (int i = 0; i < history.size(); i++) {
            AggregateBucket h = history.get(i);
            closes[i] = h.getClose().doubleValue();
            highs[i] = h.getHigh().doubleValue();
            lows[i] = h.getLow().doubleValue();
        }
        closes[n - 1] = current.getClose().doubleValue();
        highs[n - 1] = current.getHigh().doubleValue();
        lows[n - 1] = current.getLow().doubleValue();

        double[] bands = IndicatorCalculator.bollinger(closes, 20, 2.0);
        return Indicators.builder()
                .sma7(IndicatorCalculator.sma(closes, 7))
                .sma20(IndicatorCalculator.sma(closes, 20))
                .ema12(IndicatorCalculator.ema(closes, 12))
                .ema26(IndicatorCalculator.ema(closes, 26))
                .rsi14(IndicatorCalculator.rsi(closes, 14))
                .macd(IndicatorCalculator.macd(closes, 12, 26))
                .bollingerUpper(bands == null ? null : bands[0])
                .bollingerLower(bands == null ? null : bands[2])
                .atr14(IndicatorCalculator.atr(highs, lows, closes, 14))
                .build();
    }

    private List<AggregateBucket> previousBuckets(String entity, BucketRange range) {
        List<AggregateBucket> newestFirst = aggregateBucketRepository
                .findByEntityAndGranularityAndBucketStartLessThanOrderByBucketStartDesc(
                        entity, range.granularity(), range.start(),
                        PageRequest.of(0, Math.max(1, aggregationProperties.getLookbackBuckets())));
        List<AggregateBucket> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }
}
