package com.marketsync.aggregation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * marketsync.aggregation.*
 */
@ConfigurationProperties(prefix = "marketsync.aggregation")
@NoArgsConstructor
@Getter
@Setter
public class AggregationProperties {

    /** Previous buckets of the same granularity loaded as indicator history. */
    private int lookbackBuckets = 60;
}
