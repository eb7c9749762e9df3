package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observation of an entity (e.g. BTC quote) from one source.
 * naturalKey = ENTITY|observedAt|source is the idempotency key for upsert; newest observedAt wins.
 * Stored regardless of qualityScore; aggregation and alerting only read records above the minimum score.
 */
@Document(collection = "market_records")
@CompoundIndex(name = "entity_observedAt", def = "{'entity': 1, 'observedAt': 1}")
@CompoundIndex(name = "entity_quality_observedAt", def = "{'entity': 1, 'qualityScore': 1, 'observedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MarketRecord {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String naturalKey;
    private String source;
    /** Upper-cased symbol without quote suffix, e.g. BTC. */
    private String entity;
    private Instant observedAt;
    private BigDecimal price;
    private BigDecimal volume24h;
    private BigDecimal marketCap;
    private BigDecimal percentChange24h;
    /** Source-specific extra fields, kept for audit. */
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private double qualityScore;
    @Indexed
    private Instant ingestedAt;

    public static String naturalKeyOf(String entity, Instant observedAt, String source) {
        return entity + "|" + observedAt.toString() + "|" + source;
    }
}
