package com.marketsync.api.dto;

import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.Indicators;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record AggregateBucketResponse(
        String entity,
        String granularity,
        Instant bucketStart,
        Instant bucketEnd,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume,
        Double priceChangePct,
        Indicators indicators,
        int contributingRecordCount,
        double completenessScore,
        List<String> sources
) {

    public static AggregateBucketResponse from(AggregateBucket b) {
        return new AggregateBucketResponse(b.getEntity(), b.getGranularity().name(), b.getBucketStart(), b.getBucketEnd(),
                b.getOpen(), b.getHigh(), b.getLow(), b.getClose(), b.getVolume(), b.getPriceChangePct(),
                b.getIndicators(), b.getContributingRecordCount(), b.getCompletenessScore(), b.getSources());
    }
}
