package com.marketsync.aggregation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class AggregationConfig {
}
