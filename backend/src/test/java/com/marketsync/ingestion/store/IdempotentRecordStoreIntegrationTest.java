package com.marketsync.ingestion.store;

import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.MarketRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentRecordStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    IdempotentRecordStore store;
    @Autowired
    MarketRecordRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    private static MarketRecord record(String naturalKey, Instant observedAt, String price) {
        MarketRecord r = new MarketRecord();
        r.setNaturalKey(naturalKey);
        r.setSource("cmc");
        r.setEntity("BTC");
        r.setObservedAt(observedAt);
        r.setPrice(new BigDecimal(price));
        r.setVolume24h(new BigDecimal("25000000"));
        r.setQualityScore(0.95);
        r.setIngestedAt(Instant.parse("2025-03-01T11:00:00Z"));
        return r;
    }

    @Test
    @DisplayName("double write of the same natural key results in a single record with the latest payload")
    void doubleWrite_singleRecord() {
        Instant ts = Instant.parse("2025-03-01T10:15:00Z");
        String key = MarketRecord.naturalKeyOf("BTC", ts, "cmc");

        assertThat(store.upsert(record(key, ts, "64000"))).isEqualTo(UpsertOutcome.INSERTED);
        assertThat(store.upsert(record(key, ts, "64010"))).isEqualTo(UpsertOutcome.UPDATED);
        assertThat(store.upsert(record(key, ts, "64010"))).isEqualTo(UpsertOutcome.UNCHANGED);

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findByNaturalKey(key)).get()
                .extracting(MarketRecord::getPrice)
                .satisfies(p -> assertThat(p).isEqualByComparingTo("64010"));
    }

    @Test
    @DisplayName("an older observation for the same key never overwrites a newer one")
    void olderObservation_isStale() {
        String key = "BTC|quote|cmc";
        assertThat(store.upsert(record(key, Instant.parse("2025-03-01T10:30:00Z"), "64500")))
                .isEqualTo(UpsertOutcome.INSERTED);

        UpsertOutcome outcome = store.upsert(record(key, Instant.parse("2025-03-01T10:00:00Z"), "63000"));

        assertThat(outcome).isEqualTo(UpsertOutcome.STALE);
        MarketRecord stored = repository.findByNaturalKey(key).orElseThrow();
        assertThat(stored.getPrice()).isEqualByComparingTo("64500");
        assertThat(stored.getObservedAt()).isEqualTo(Instant.parse("2025-03-01T10:30:00Z"));
    }

    @Test
    void upsertAll_countsOutcomes() {
        Instant t1 = Instant.parse("2025-03-01T10:15:00Z");
        Instant t2 = Instant.parse("2025-03-01T10:16:00Z");
        List<MarketRecord> batch = List.of(
                record(MarketRecord.naturalKeyOf("BTC", t1, "cmc"), t1, "64000"),
                record(MarketRecord.naturalKeyOf("BTC", t2, "cmc"), t2, "64001"),
                record(MarketRecord.naturalKeyOf("BTC", t1, "cmc"), t1, "64000"));

        Map<UpsertOutcome, Integer> counts = store.upsertAll(batch);

        assertThat(counts).containsEntry(UpsertOutcome.INSERTED, 2).containsEntry(UpsertOutcome.UNCHANGED, 1);
        assertThat(repository.count()).isEqualTo(2);
    }
}
