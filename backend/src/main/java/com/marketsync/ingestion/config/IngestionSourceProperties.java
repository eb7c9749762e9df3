package com.marketsync.ingestion.config;

import com.marketsync.ingestion.quality.SourceTier;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream source definitions keyed by source id (marketsync.sources.&lt;id&gt;).
 * A definition with a url gets a generic JSON-over-HTTP collaborator; otherwise a SourceCollaborator bean
 * with the same id must exist.
 */
@ConfigurationProperties(prefix = "marketsync")
@NoArgsConstructor
@Getter
@Setter
public class IngestionSourceProperties {

    private Map<String, SourceDefinition> sources = new LinkedHashMap<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SourceDefinition {

        /** Reliability tier; scales every quality score from this source. */
        private SourceTier tier = SourceTier.MEDIUM;

        /** Endpoint returning a JSON list of items; null when a SourceCollaborator bean provides the data. */
        private String url;

        /** Query parameter carrying the watermark (ISO-8601). Omitted when the watermark is unknown. */
        private String sinceParam = "since";

        /** Dot path to the item array; empty when the response body is the array. */
        private String itemsPath = "";

        private FieldMapping fields = new FieldMapping();

        /** Suffix stripped from symbols, e.g. USDT for BTCUSDT. */
        private String quoteSuffix = "";

        /** When non-empty, only these entities are ingested. */
        private List<String> entities = new ArrayList<>();

        /** Symbols containing any of these markers are skipped (leveraged tokens). */
        private List<String> excludeMarkers = new ArrayList<>();

        private int rateLimitPerSecond = 5;

        /** Max concurrent in-flight fetches against this source. */
        private int maxConcurrentFetches = 2;

        /** HTTP timeout per call in ms. */
        private long timeoutMs = 10_000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class FieldMapping {
        private String symbol = "symbol";
        private String timestamp = "last_updated";
        private String price = "price";
        private String volume = "volume_24h";
        private String marketCap = "market_cap";
        private String percentChange24h = "percent_change_24h";
    }
}
