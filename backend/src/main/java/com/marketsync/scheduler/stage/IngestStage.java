package com.marketsync.scheduler.stage;

import com.marketsync.domain.MarketRecord;
import com.marketsync.domain.RunStats;
import com.marketsync.ingestion.quality.QualityScorer;
import com.marketsync.ingestion.quality.ReferencePriceResolver;
import com.marketsync.ingestion.quality.ScoringContext;
import com.marketsync.ingestion.quality.SourceTier;
import com.marketsync.ingestion.source.FetchResult;
import com.marketsync.ingestion.source.SourceAdapter;
import com.marketsync.ingestion.source.SourceRegistry;
import com.marketsync.ingestion.store.IdempotentRecordStore;
import com.marketsync.ingestion.store.UpsertOutcome;
import com.marketsync.ingestion.store.WatermarkStore;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Fetch → score → upsert per source. Every record is stored whatever its score; the watermark candidate is only
 * staged on the context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestStage implements PipelineStage {

    private final SourceAdapter sourceAdapter;
    private final SourceRegistry sourceRegistry;
    private final WatermarkStore watermarkStore;
    private final QualityScorer qualityScorer;
    private final ReferencePriceResolver referencePriceResolver;
    private final IdempotentRecordStore idempotentRecordStore;

    @Override
    public StageType type() {
        return StageType.INGEST;
    }

    @Override
    public void execute(StageContext context) {
        RunStats stats = context.getStats();
        double qualitySum = 0.0;
        int scored = 0;
        for (String sourceId : context.getJob().sourceIds()) {
            context.checkDeadline();
            Instant watermark = watermarkStore.get(context.getJob().id(), sourceId).orElse(null);
            FetchResult fetched = sourceAdapter.fetch(sourceId, watermark);
            stats.setRecordsFetched(stats.getRecordsFetched() + fetched.records().size());
            stats.setRecordsRejected(stats.getRecordsRejected() + fetched.rejected());

            SourceTier tier = sourceRegistry.get(sourceId).definition().getTier();
            Map<String, BigDecimal> references = new HashMap<>();
            for (MarketRecord record : fetched.records()) {
                BigDecimal reference = references.computeIfAbsent(record.getEntity(), referencePriceResolver::referencePrice);
                record.setQualityScore(qualityScorer.score(record, new ScoringContext(tier, reference)));
                if (!qualityScorer.isTrustworthy(record)) {
                    stats.setRecordsBelowQuality(stats.getRecordsBelowQuality() + 1);
                    log.debug("Record {} scored {} (below minimum); stored for audit only",
                            record.getNaturalKey(), record.getQualityScore());
                }
                qualitySum += record.getQualityScore();
                scored++;
            }
            context.checkDeadline();
            Map<UpsertOutcome, Integer> outcomes = idempotentRecordStore.upsertAll(fetched.records());
            int stored = outcomes.getOrDefault(UpsertOutcome.INSERTED, 0) + outcomes.getOrDefault(UpsertOutcome.UPDATED, 0);
            stats.setRecordsStored(stats.getRecordsStored() + stored);
            context.addIngested(fetched.records());
            context.stageWatermark(sourceId, fetched.newWatermark());
            log.info("Job {} source {}: fetched {}, stored {}, outcomes {}",
                    context.getJob().id(), sourceId, fetched.records().size(), stored, outcomes);
        }
        if (scored > 0) {
            stats.setAvgQualityScore(qualitySum / scored);
        }
    }
}
