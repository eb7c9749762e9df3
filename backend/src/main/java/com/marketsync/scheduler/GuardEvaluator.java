package com.marketsync.scheduler;

import com.marketsync.domain.MarketRecordRepository;
import com.marketsync.ingestion.source.SourceAdapter;
import com.marketsync.ingestion.store.WatermarkStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Evaluates a job's guard. Returns the skip reason when the run has no work, empty when it should proceed.
 */
@Component
@RequiredArgsConstructor
public class GuardEvaluator {

    private final SourceAdapter sourceAdapter;
    private final WatermarkStore watermarkStore;
    private final MarketRecordRepository marketRecordRepository;

    public Optional<String> skipReason(Job job, Instant tickTime) {
        return switch (job.guard()) {
            case ALWAYS -> Optional.empty();
            case NEW_SOURCE_DATA -> anySourceHasNewData(job) ? Optional.empty() : Optional.of("no new source data");
            case RECENT_RECORDS -> marketRecordRepository.existsByEntityInAndObservedAtGreaterThanEqual(
                    job.entities(), tickTime.minus(job.interval()))
                    ? Optional.empty()
                    : Optional.of("no records in the last " + job.interval());
        };
    }

    private boolean anySourceHasNewData(Job job) {
        for (String sourceId : job.sourceIds()) {
            Instant watermark = watermarkStore.get(job.id(), sourceId).orElse(null);
            if (sourceAdapter.hasNewData(sourceId, watermark)) {
                return true;
            }
        }
        return false;
    }
}
