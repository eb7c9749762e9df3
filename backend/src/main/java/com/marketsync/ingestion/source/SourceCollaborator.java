package com.marketsync.ingestion.source;

import java.time.Instant;
import java.util.List;

/**
 * Upstream data provider. The pipeline assumes nothing about the protocol, only that items carry a
 * timestamp and a stable identity.
 */
public interface SourceCollaborator {

    String sourceId();

    /**
     * Items observed after {@code since} (null = everything available). Implementations may return items at or
     * before {@code since} and in any order; the adapter filters and de-duplicates.
     *
     * @throws TransientSourceException on network, rate-limit or upstream availability failures
     */
    List<RawItem> list(Instant since);

    /**
     * Cheap existence check used by guard predicates. Default lists and checks for any newer item.
     */
    default boolean hasItemsSince(Instant since) {
        return list(since).stream()
                .anyMatch(i -> i.timestamp() != null && (since == null || i.timestamp().isAfter(since)));
    }
}
