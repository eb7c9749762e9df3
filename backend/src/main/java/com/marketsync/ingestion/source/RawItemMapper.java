package com.marketsync.ingestion.source;

import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.config.IngestionSourceProperties.SourceDefinition;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates a raw item and maps it to an unscored MarketRecord.
 * Symbols are upper-cased and stripped of the source's quote suffix (BTCUSDT → BTC).
 */
public final class RawItemMapper {

    private RawItemMapper() {
    }

    /**
     * @return empty when the item is well-formed but filtered out (not in allow-list, leveraged token)
     * @throws DataIntegrityException when the item is malformed
     */
    public static Optional<MarketRecord> toRecord(String sourceId, SourceDefinition definition, RawItem item, Instant ingestedAt) {
        if (item == null) {
            throw new DataIntegrityException("null item");
        }
        if (item.symbol() == null || item.symbol().isBlank()) {
            throw new DataIntegrityException("missing symbol");
        }
        if (item.timestamp() == null) {
            throw new DataIntegrityException("missing timestamp for " + item.symbol());
        }
        if (item.price() == null) {
            throw new DataIntegrityException("missing price for " + item.symbol() + " at " + item.timestamp());
        }
        String symbol = item.symbol().trim().toUpperCase(Locale.ROOT);
        for (String marker : definition.getExcludeMarkers()) {
            if (!marker.isBlank() && symbol.contains(marker.toUpperCase(Locale.ROOT))) {
                return Optional.empty();
            }
        }
        String entity = normalizeEntity(symbol, definition.getQuoteSuffix());
        if (entity.isEmpty()) {
            throw new DataIntegrityException("symbol " + symbol + " is only a quote suffix");
        }
        if (!definition.getEntities().isEmpty()
                && definition.getEntities().stream().noneMatch(e -> e.equalsIgnoreCase(entity))) {
            return Optional.empty();
        }
        MarketRecord r = new MarketRecord();
        r.setSource(sourceId);
        r.setEntity(entity);
        r.setObservedAt(item.timestamp());
        r.setNaturalKey(MarketRecord.naturalKeyOf(entity, item.timestamp(), sourceId));
        r.setPrice(item.price());
        r.setVolume24h(item.volume24h());
        r.setMarketCap(item.marketCap());
        r.setPercentChange24h(item.percentChange24h());
        if (item.attributes() != null) {
            r.setAttributes(new LinkedHashMap<>(item.attributes()));
        }
        r.setIngestedAt(ingestedAt);
        return Optional.of(r);
    }

    static String normalizeEntity(String symbol, String quoteSuffix) {
        if (quoteSuffix == null || quoteSuffix.isBlank()) {
            return symbol;
        }
        String suffix = quoteSuffix.toUpperCase(Locale.ROOT);
        return symbol.endsWith(suffix) ? symbol.substring(0, symbol.length() - suffix.length()) : symbol;
    }
}
