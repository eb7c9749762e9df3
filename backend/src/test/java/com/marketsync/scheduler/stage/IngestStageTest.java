package com.marketsync.scheduler.stage;

import com.marketsync.domain.BucketGranularity;
import com.marketsync.domain.MarketRecord;
import com.marketsync.ingestion.config.IngestionSourceProperties.SourceDefinition;
import com.marketsync.ingestion.quality.QualityScorer;
import com.marketsync.ingestion.quality.ReferencePriceResolver;
import com.marketsync.ingestion.quality.ScoringContext;
import com.marketsync.ingestion.quality.SourceTier;
import com.marketsync.ingestion.source.FetchResult;
import com.marketsync.ingestion.source.SourceAdapter;
import com.marketsync.ingestion.source.SourceRegistry;
import com.marketsync.ingestion.source.SourceRegistry.RegisteredSource;
import com.marketsync.ingestion.store.IdempotentRecordStore;
import com.marketsync.ingestion.store.UpsertOutcome;
import com.marketsync.ingestion.store.WatermarkStore;
import com.marketsync.scheduler.GuardType;
import com.marketsync.scheduler.Job;
import com.marketsync.scheduler.JobSchedule;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestStageTest {

    private static final Instant TICK = Instant.parse("2025-03-01T11:00:00Z");
    private static final Instant WATERMARK = Instant.parse("2025-03-01T09:59:00Z");
    private static final Instant CANDIDATE = Instant.parse("2025-03-01T10:45:00Z");

    @Mock
    SourceAdapter sourceAdapter;
    @Mock
    SourceRegistry sourceRegistry;
    @Mock
    WatermarkStore watermarkStore;
    @Mock
    QualityScorer qualityScorer;
    @Mock
    ReferencePriceResolver referencePriceResolver;
    @Mock
    IdempotentRecordStore idempotentRecordStore;

    @InjectMocks
    IngestStage ingestStage;

    private static StageContext context() {
        Job job = new Job("market-data-sync", true, new JobSchedule(Duration.ofMinutes(3), Instant.EPOCH, null),
                GuardType.NEW_SOURCE_DATA, List.of(StageType.INGEST), List.of("cmc"), List.of(),
                List.of(BucketGranularity.HOURLY), List.of(), List.of(), List.of(), null);
        return new StageContext(job, TICK, TICK.plus(Duration.ofMinutes(3)), Clock.fixed(TICK, ZoneOffset.UTC));
    }

    private static MarketRecord record(String observedAt) {
        MarketRecord r = new MarketRecord();
        r.setEntity("BTC");
        r.setSource("cmc");
        r.setObservedAt(Instant.parse(observedAt));
        r.setPrice(new BigDecimal("63000"));
        return r;
    }

    @Test
    @DisplayName("records are scored and all stored; low scores are counted; the watermark is only staged")
    void scoresStoresAndStagesWatermark() {
        MarketRecord good = record("2025-03-01T10:15:00Z");
        MarketRecord poor = record("2025-03-01T10:45:00Z");
        SourceDefinition definition = new SourceDefinition();
        definition.setTier(SourceTier.HIGH);
        when(watermarkStore.get("market-data-sync", "cmc")).thenReturn(Optional.of(WATERMARK));
        when(sourceAdapter.fetch("cmc", WATERMARK)).thenReturn(new FetchResult("cmc", List.of(good, poor), CANDIDATE, 1));
        when(sourceRegistry.get("cmc")).thenReturn(new RegisteredSource("cmc", null, definition, null, null));
        when(referencePriceResolver.referencePrice("BTC")).thenReturn(new BigDecimal("62000"));
        when(qualityScorer.score(eq(good), any(ScoringContext.class))).thenReturn(0.9);
        when(qualityScorer.score(eq(poor), any(ScoringContext.class))).thenReturn(0.3);
        when(qualityScorer.isTrustworthy(good)).thenReturn(true);
        when(qualityScorer.isTrustworthy(poor)).thenReturn(false);
        when(idempotentRecordStore.upsertAll(List.of(good, poor)))
                .thenReturn(Map.of(UpsertOutcome.INSERTED, 1, UpsertOutcome.UNCHANGED, 1));
        StageContext ctx = context();

        ingestStage.execute(ctx);

        assertThat(good.getQualityScore()).isEqualTo(0.9);
        assertThat(poor.getQualityScore()).isEqualTo(0.3);
        assertThat(ctx.getStats().getRecordsFetched()).isEqualTo(2);
        assertThat(ctx.getStats().getRecordsRejected()).isEqualTo(1);
        assertThat(ctx.getStats().getRecordsBelowQuality()).isEqualTo(1);
        assertThat(ctx.getStats().getRecordsStored()).isEqualTo(1);
        assertThat(ctx.getStats().getAvgQualityScore()).isCloseTo(0.6, offset(1e-9));
        assertThat(ctx.getIngested()).containsExactly(good, poor);
        assertThat(ctx.getPendingWatermarks()).containsEntry("cmc", CANDIDATE);
        verify(referencePriceResolver, times(1)).referencePrice("BTC");
        verify(watermarkStore, times(0)).advance(any(), any(), any());
    }

    @Test
    void failedFetch_propagatesWithoutStoring() {
        when(watermarkStore.get("market-data-sync", "cmc")).thenReturn(Optional.empty());
        when(sourceAdapter.fetch("cmc", null)).thenThrow(new IllegalStateException("source down"));
        StageContext ctx = context();

        assertThatThrownBy(() -> ingestStage.execute(ctx))
                .hasMessage("source down");
        verifyNoInteractions(idempotentRecordStore);
        assertThat(ctx.getPendingWatermarks()).isEmpty();
    }
}
