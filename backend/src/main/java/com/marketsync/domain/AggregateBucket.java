package com.marketsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OHLC rollup of qualifying records for one entity in [bucketStart, bucketEnd).
 * Always recomputed from stored records, never patched. Invariant: low ≤ open, close ≤ high.
 */
@Document(collection = "aggregate_buckets")
@CompoundIndex(name = "entity_granularity_start", def = "{'entity': 1, 'granularity': 1, 'bucketStart': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AggregateBucket {

    @Id
    private String id;
    @EqualsAndHashCode.Include
    private String entity;
    @EqualsAndHashCode.Include
    private BucketGranularity granularity;
    @EqualsAndHashCode.Include
    private Instant bucketStart;
    private Instant bucketEnd;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    /** Mean 24h volume scaled to the bucket length. */
    private BigDecimal volume;
    private Double priceChangePct;
    private Indicators indicators = Indicators.empty();
    private int contributingRecordCount;
    /** Mean quality score of contributing records. */
    private double completenessScore;
    private List<String> sources = new ArrayList<>();
    private Instant rebuiltAt;

    public String bucketKey() {
        return entity + "|" + granularity + "|" + bucketStart;
    }
}
