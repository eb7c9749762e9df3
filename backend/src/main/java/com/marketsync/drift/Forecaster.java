package com.marketsync.drift;

import com.marketsync.domain.AggregateBucket;

import java.util.List;

/**
 * External model. The pipeline only records what it reports; training and inference live elsewhere.
 */
public interface Forecaster {

    /**
     * @param history daily buckets for the entity, oldest first
     */
    ForecastResult forecast(String modelId, String entity, List<AggregateBucket> history);
}
