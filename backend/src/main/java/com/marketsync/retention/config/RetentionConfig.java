package com.marketsync.retention.config;

import com.marketsync.retention.RetentionPolicyRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionConfig {

    @Bean
    public RetentionPolicyRegistry retentionPolicyRegistry(RetentionProperties retentionProperties) {
        return new RetentionPolicyRegistry(retentionProperties.toPolicies());
    }
}
