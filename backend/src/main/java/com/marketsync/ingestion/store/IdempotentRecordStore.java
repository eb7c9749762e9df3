package com.marketsync.ingestion.store;

import com.marketsync.domain.MarketRecord;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts market records keyed by naturalKey. Newest observedAt wins; an equal observedAt replaces the payload.
 * <p>
 * Atomic per key: the update only matches a stored row that is not newer than the incoming one. When the stored
 * row is newer, the upsert falls through to an insert and collides with the unique naturalKey index, which is
 * the STALE signal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentRecordStore {

    private final MongoTemplate mongoTemplate;

    public UpsertOutcome upsert(MarketRecord record) {
        Query query = Query.query(Criteria.where("naturalKey").is(record.getNaturalKey())
                .and("observedAt").lte(record.getObservedAt()));
        Update update = new Update()
                .set("source", record.getSource())
                .set("entity", record.getEntity())
                .set("observedAt", record.getObservedAt())
                .set("price", record.getPrice())
                .set("volume24h", record.getVolume24h())
                .set("marketCap", record.getMarketCap())
                .set("percentChange24h", record.getPercentChange24h())
                .set("attributes", record.getAttributes())
                .set("qualityScore", record.getQualityScore())
                .setOnInsert("naturalKey", record.getNaturalKey())
                .setOnInsert("ingestedAt", record.getIngestedAt());
        try {
            UpdateResult result = mongoTemplate.upsert(query, update, MarketRecord.class);
            if (result.getUpsertedId() != null) {
                return UpsertOutcome.INSERTED;
            }
            return result.getModifiedCount() > 0 ? UpsertOutcome.UPDATED : UpsertOutcome.UNCHANGED;
        } catch (DuplicateKeyException e) {
            log.debug("Stale write for {} at {} ignored", record.getNaturalKey(), record.getObservedAt());
            return UpsertOutcome.STALE;
        } catch (DataAccessException e) {
            throw new StorageException("Upsert failed for " + record.getNaturalKey(), e);
        }
    }

    /**
     * Applies the batch in order. The first storage failure aborts the remaining writes.
     */
    public Map<UpsertOutcome, Integer> upsertAll(List<MarketRecord> batch) {
        Map<UpsertOutcome, Integer> counts = new EnumMap<>(UpsertOutcome.class);
        for (MarketRecord record : batch) {
            counts.merge(upsert(record), 1, Integer::sum);
        }
        return counts;
    }
}
