package com.marketsync.api.controller;

import com.marketsync.aggregation.AggregateQueryService;
import com.marketsync.api.dto.AggregateBucketResponse;
import com.marketsync.domain.BucketGranularity;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * GET /aggregates/{entity}?granularity=&from=&to= (ISO-8601 instants; defaults to the last 7 days).
 */
@RestController
@RequestMapping("/api/v1/aggregates")
@RequiredArgsConstructor
public class AggregateController {

    private static final Duration DEFAULT_RANGE = Duration.ofDays(7);

    private final AggregateQueryService aggregateQueryService;
    private final Clock clock;

    @GetMapping("/{entity}")
    public List<AggregateBucketResponse> buckets(
            @PathVariable String entity,
            @RequestParam(defaultValue = "HOURLY") BucketGranularity granularity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        return aggregateQueryService.buckets(entity, granularity, start, end).stream()
                .map(AggregateBucketResponse::from)
                .toList();
    }
}
