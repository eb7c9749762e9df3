package com.marketsync.ingestion.quality;

import com.marketsync.config.CaffeineConfig;
import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.MarketRecordRepository;
import com.marketsync.ingestion.config.QualityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Latest trustworthy price per entity, used as the plausibility reference when scoring new records.
 */
@Component
@RequiredArgsConstructor
public class ReferencePriceResolver {

    private final MarketRecordRepository marketRecordRepository;
    private final QualityProperties qualityProperties;

    @Cacheable(cacheNames = CaffeineConfig.REFERENCE_PRICE_CACHE, unless = "#result == null")
    public BigDecimal referencePrice(String entity) {
        Optional<MarketRecord> latest = marketRecordRepository
                .findFirstByEntityAndQualityScoreGreaterThanEqualOrderByObservedAtDesc(entity, qualityProperties.getMinQualityScore());
        return latest.map(MarketRecord::getPrice).orElse(null);
    }
}
