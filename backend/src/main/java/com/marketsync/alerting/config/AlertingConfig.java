package com.marketsync.alerting.config;

import com.marketsync.alerting.rule.AlertRuleRegistry;
import com.marketsync.alerting.sink.WebhookAlertSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(AlertRuleProperties.class)
public class AlertingConfig {

    @Bean
    public AlertRuleRegistry alertRuleRegistry(AlertRuleProperties alertRuleProperties) {
        return new AlertRuleRegistry(alertRuleProperties.toRules());
    }

    @Bean
    @ConditionalOnProperty(prefix = "marketsync.alerts", name = "webhook-url")
    public WebhookAlertSink webhookAlertSink(AlertRuleProperties alertRuleProperties, WebClient.Builder webClientBuilder) {
        return new WebhookAlertSink(alertRuleProperties.getWebhookUrl(), webClientBuilder.clone());
    }
}
