package com.marketsync.ingestion.store;

import com.marketsync.domain.Watermark;
import com.marketsync.domain.WatermarkRepository;
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

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable per-(job, source) ingestion progress. Only moves forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatermarkStore {

    private final MongoTemplate mongoTemplate;
    private final WatermarkRepository watermarkRepository;
    private final Clock clock;

    public Optional<Instant> get(String jobId, String sourceId) {
        try {
            return watermarkRepository.findByJobIdAndSourceId(jobId, sourceId)
                    .map(Watermark::getLastSeenTimestamp);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot read watermark " + jobId + "/" + sourceId, e);
        }
    }

    /**
     * Moves the watermark to {@code candidate} if it is newer than the stored value.
     *
     * @return true when the stored value changed
     */
    public boolean advance(String jobId, String sourceId, Instant candidate) {
        if (candidate == null) {
            return false;
        }
        Query query = Query.query(Criteria.where("jobId").is(jobId)
                .and("sourceId").is(sourceId)
                .orOperator(
                        Criteria.where("lastSeenTimestamp").lt(candidate),
                        Criteria.where("lastSeenTimestamp").exists(false)));
        Update update = new Update()
                .set("lastSeenTimestamp", candidate)
                .set("updatedAt", clock.instant());
        try {
            UpdateResult result = mongoTemplate.upsert(query, update, Watermark.class);
            boolean advanced = result.getUpsertedId() != null || result.getModifiedCount() > 0;
            if (advanced) {
                log.info("Watermark {}/{} advanced to {}", jobId, sourceId, candidate);
            }
            return advanced;
        } catch (DuplicateKeyException e) {
            log.debug("Watermark {}/{} already at or beyond {}", jobId, sourceId, candidate);
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("Cannot advance watermark " + jobId + "/" + sourceId, e);
        }
    }
}
