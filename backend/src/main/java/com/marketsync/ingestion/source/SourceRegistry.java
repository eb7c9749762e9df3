package com.marketsync.ingestion.source;

import com.marketsync.common.ConfigurationException;
import com.marketsync.ingestion.config.IngestionSourceProperties;
import com.marketsync.ingestion.config.IngestionSourceProperties.SourceDefinition;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source id → collaborator, definition and per-source limiters (rate limit + bulkhead on in-flight fetches).
 */
public class SourceRegistry {

    public record RegisteredSource(
            String sourceId,
            SourceCollaborator collaborator,
            SourceDefinition definition,
            RateLimiter rateLimiter,
            Bulkhead bulkhead) {
    }

    private final Map<String, RegisteredSource> sources;

    public SourceRegistry(List<SourceCollaborator> collaborators, IngestionSourceProperties properties) {
        Map<String, SourceCollaborator> byId = new LinkedHashMap<>();
        for (SourceCollaborator c : collaborators) {
            if (byId.putIfAbsent(c.sourceId(), c) != null) {
                throw new ConfigurationException("Duplicate source collaborator for id " + c.sourceId());
            }
        }
        Map<String, RegisteredSource> registered = new LinkedHashMap<>();
        for (SourceCollaborator c : byId.values()) {
            SourceDefinition definition = properties.getSources().getOrDefault(c.sourceId(), new SourceDefinition());
            registered.put(c.sourceId(), new RegisteredSource(
                    c.sourceId(), c, definition, rateLimiter(c.sourceId(), definition), bulkhead(c.sourceId(), definition)));
        }
        for (String id : properties.getSources().keySet()) {
            if (!registered.containsKey(id)) {
                throw new ConfigurationException("Source " + id + " has neither a url nor a SourceCollaborator bean");
            }
        }
        this.sources = Collections.unmodifiableMap(registered);
    }

    public RegisteredSource get(String sourceId) {
        RegisteredSource s = sources.get(sourceId);
        if (s == null) {
            throw new ConfigurationException("Unknown source " + sourceId);
        }
        return s;
    }

    public boolean contains(String sourceId) {
        return sources.containsKey(sourceId);
    }

    public Set<String> sourceIds() {
        return sources.keySet();
    }

    private static RateLimiter rateLimiter(String sourceId, SourceDefinition definition) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, definition.getRateLimitPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, definition.getTimeoutMs())))
                .build();
        return RateLimiter.of("source-" + sourceId, config);
    }

    private static Bulkhead bulkhead(String sourceId, SourceDefinition definition) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(Math.max(1, definition.getMaxConcurrentFetches()))
                .maxWaitDuration(Duration.ofMillis(Math.max(0L, definition.getTimeoutMs())))
                .build();
        return Bulkhead.of("source-" + sourceId, config);
    }
}
