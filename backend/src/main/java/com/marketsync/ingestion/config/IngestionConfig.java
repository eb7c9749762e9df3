package com.marketsync.ingestion.config;

import com.marketsync.common.RetryPolicy;
import com.marketsync.ingestion.source.HttpJsonSourceCollaborator;
import com.marketsync.ingestion.source.SourceCollaborator;
import com.marketsync.ingestion.source.SourceRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the source registry: SourceCollaborator beans plus one HTTP JSON collaborator per source with a url.
 */
@Configuration
@EnableConfigurationProperties({ IngestionSourceProperties.class, IngestionRetryProperties.class, QualityProperties.class })
public class IngestionConfig {

    @Bean
    public RetryPolicy sourceRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public SourceRegistry sourceRegistry(
            ObjectProvider<SourceCollaborator> collaboratorBeans,
            IngestionSourceProperties properties,
            WebClient.Builder webClientBuilder) {
        List<SourceCollaborator> collaborators = new ArrayList<>(collaboratorBeans.orderedStream().toList());
        properties.getSources().forEach((id, definition) -> {
            if (definition.getUrl() != null && !definition.getUrl().isBlank()) {
                collaborators.add(new HttpJsonSourceCollaborator(id, definition, webClientBuilder.clone()));
            }
        });
        return new SourceRegistry(collaborators, properties);
    }
}
