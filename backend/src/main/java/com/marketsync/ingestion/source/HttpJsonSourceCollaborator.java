package com.marketsync.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketsync.ingestion.config.IngestionSourceProperties.FieldMapping;
import com.marketsync.ingestion.config.IngestionSourceProperties.SourceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic JSON-over-HTTP source: GET url?since=ISO-8601, items at itemsPath, fields per FieldMapping.
 * Timestamps may be ISO-8601 strings, epoch seconds or epoch milliseconds.
 * 429/5xx and connection failures are transient; other HTTP errors are not retried within the run.
 */
@Slf4j
public class HttpJsonSourceCollaborator implements SourceCollaborator {

    /** Values above this are treated as epoch milliseconds. */
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private final String sourceId;
    private final SourceDefinition definition;
    private final WebClient webClient;

    public HttpJsonSourceCollaborator(String sourceId, SourceDefinition definition, WebClient.Builder webClientBuilder) {
        this.sourceId = sourceId;
        this.definition = definition;
        this.webClient = webClientBuilder.build();
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public List<RawItem> list(Instant since) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(definition.getUrl());
        if (since != null && definition.getSinceParam() != null && !definition.getSinceParam().isBlank()) {
            uri.queryParam(definition.getSinceParam(), since.toString());
        }
        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uri.build().toUri())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofMillis(definition.getTimeoutMs()));
        } catch (WebClientResponseException e) {
            if (isTransientStatus(e.getStatusCode())) {
                throw new TransientSourceException("HTTP " + e.getStatusCode().value() + " from " + sourceId, e);
            }
            throw new IllegalStateException("HTTP " + e.getStatusCode().value() + " from " + sourceId, e);
        } catch (WebClientRequestException e) {
            throw new TransientSourceException("Request to " + sourceId + " failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals expiry as IllegalStateException
            throw new TransientSourceException("Timeout reading from " + sourceId, e);
        }
        return parse(body);
    }

    List<RawItem> parse(JsonNode body) {
        JsonNode items = navigate(body, definition.getItemsPath());
        if (items == null || !items.isArray()) {
            throw new IllegalStateException("Response from " + sourceId + " has no item array at '" + definition.getItemsPath() + "'");
        }
        FieldMapping f = definition.getFields();
        Set<String> mapped = Set.of(f.getSymbol(), f.getTimestamp(), f.getPrice(), f.getVolume(), f.getMarketCap(), f.getPercentChange24h());
        List<RawItem> result = new ArrayList<>(items.size());
        for (JsonNode node : items) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (!mapped.contains(e.getKey()) && e.getValue().isValueNode()) {
                    attributes.put(e.getKey(), e.getValue().asText());
                }
            }
            result.add(new RawItem(
                    text(node, f.getSymbol()),
                    timestamp(node, f.getTimestamp()),
                    decimal(node, f.getPrice()),
                    decimal(node, f.getVolume()),
                    decimal(node, f.getMarketCap()),
                    decimal(node, f.getPercentChange24h()),
                    attributes));
        }
        return result;
    }

    private static JsonNode navigate(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return root;
        }
        JsonNode current = root;
        for (String part : path.split("\\.")) {
            current = current.path(part);
        }
        return current.isMissingNode() ? null : current;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    /** Unparseable numbers become null; the mapper rejects a missing price. */
    private BigDecimal decimal(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.decimalValue();
        }
        try {
            return new BigDecimal(v.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable {} '{}' from {}", field, v.asText(), sourceId);
            return null;
        }
    }

    private Instant timestamp(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            long n = v.asLong();
            return n > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(n) : Instant.ofEpochSecond(n);
        }
        try {
            return Instant.parse(v.asText().trim());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable {} '{}' from {}", field, v.asText(), sourceId);
            return null;
        }
    }

    private static boolean isTransientStatus(HttpStatusCode status) {
        return status.value() == 429 || status.is5xxServerError();
    }
}
