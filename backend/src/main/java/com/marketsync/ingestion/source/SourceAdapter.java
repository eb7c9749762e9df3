package com.marketsync.ingestion.source;

import com.marketsync.common.RetryPolicy;
import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.source.SourceRegistry.RegisteredSource;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pulls records newer than a watermark from one source.
 * <ul>
 *   <li>Strict filter: only {@code observedAt > watermark}, so boundary rows are never reprocessed.</li>
 *   <li>De-duplicates by natural key (later listing wins) because upstreams may repeat or reorder items.</li>
 *   <li>All-or-nothing: a failed list call returns no records; retried here with backoff, then surfaced as
 *       {@link TransientSourceException}.</li>
 *   <li>Every call passes the source's rate limiter and bulkhead (bounded in-flight fetches).</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceAdapter {

    private final SourceRegistry sourceRegistry;
    private final RetryPolicy sourceRetryPolicy;
    private final Clock clock;

    public FetchResult fetch(String sourceId, Instant watermark) {
        RegisteredSource source = sourceRegistry.get(sourceId);
        List<RawItem> items = callGuarded(source, "list", () -> source.collaborator().list(watermark));
        Instant ingestedAt = clock.instant();

        Map<String, MarketRecord> byKey = new LinkedHashMap<>();
        Instant candidate = watermark;
        int rejected = 0;
        for (RawItem item : items) {
            if (item != null && item.timestamp() != null) {
                if (watermark != null && !item.timestamp().isAfter(watermark)) {
                    continue;
                }
                if (candidate == null || item.timestamp().isAfter(candidate)) {
                    candidate = item.timestamp();
                }
            }
            try {
                Optional<MarketRecord> mapped = RawItemMapper.toRecord(sourceId, source.definition(), item, ingestedAt);
                mapped.ifPresent(r -> byKey.put(r.getNaturalKey(), r));
            } catch (DataIntegrityException e) {
                rejected++;
                log.warn("Dropped item from source {}: {} (item={})", sourceId, e.getMessage(), item);
            }
        }
        List<MarketRecord> records = byKey.values().stream()
                .sorted(Comparator.comparing(MarketRecord::getObservedAt))
                .toList();
        log.debug("Fetched {} record(s) from {} since {} ({} rejected)", records.size(), sourceId, watermark, rejected);
        return new FetchResult(sourceId, records, candidate, rejected);
    }

    /**
     * Guard-predicate existence check: does the source have anything newer than the watermark?
     */
    public boolean hasNewData(String sourceId, Instant watermark) {
        RegisteredSource source = sourceRegistry.get(sourceId);
        return callGuarded(source, "existence check", () -> source.collaborator().hasItemsSince(watermark));
    }

    private <T> T callGuarded(RegisteredSource source, String operation, Supplier<T> call) {
        Supplier<T> limited = Bulkhead.decorateSupplier(source.bulkhead(),
                RateLimiter.decorateSupplier(source.rateLimiter(), call));
        try {
            return sourceRetryPolicy.execute(limited::get, SourceAdapter::isRetryable);
        } catch (TransientSourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientSourceException(
                    operation + " failed for source " + source.sourceId() + ": " + messageOf(e), e);
        }
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof TransientSourceException
                || e instanceof RequestNotPermitted
                || e instanceof BulkheadFullException;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
