package com.marketsync.retention;

import com.marketsync.ingestion.store.StorageException;
import com.marketsync.retention.config.RetentionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Moves aged documents to the policy's archive collection, then deletes them from the source.
 * <p>
 * Archive copies keep the source _id, so a document already in the archive is not archived again and a sweep
 * interrupted between archive and delete finishes on the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionManager {

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final RetentionProperties retentionProperties;

    public SweepResult sweep(RetentionPolicy policy, Instant now) {
        return sweep(policy, now, () -> { });
    }

    /**
     * @param betweenBatches invoked before every batch; may throw to stop the sweep (deadline)
     */
    public SweepResult sweep(RetentionPolicy policy, Instant now, Runnable betweenBatches) {
        String source = policy.tableClass().collection();
        Criteria aged = agedCriteria(policy, now);
        SweepResult total = SweepResult.EMPTY;
        try {
            while (true) {
                betweenBatches.run();
                Query query = Query.query(aged)
                        .with(Sort.by(ID))
                        .limit(Math.max(1, retentionProperties.getBatchSize()));
                List<Document> batch = mongoTemplate.find(query, Document.class, source);
                if (batch.isEmpty()) {
                    break;
                }
                total = total.plus(archiveThenDelete(batch, source, policy.archiveTarget()));
            }
        } catch (DataAccessException e) {
            throw new StorageException("Retention sweep " + policy.id() + " failed on " + source, e);
        }
        log.info("Retention {}: archived {} and deleted {} from {} into {}",
                policy.id(), total.archived(), total.deleted(), source, policy.archiveTarget());
        return total;
    }

    private SweepResult archiveThenDelete(List<Document> batch, String source, String archive) {
        List<Object> ids = batch.stream().map(d -> d.get(ID)).toList();
        Set<Object> alreadyArchived = new HashSet<>();
        mongoTemplate.find(Query.query(Criteria.where(ID).in(ids)), Document.class, archive)
                .forEach(d -> alreadyArchived.add(d.get(ID)));
        List<Document> toArchive = batch.stream()
                .filter(d -> !alreadyArchived.contains(d.get(ID)))
                .toList();
        long archived = insertIgnoringDuplicates(toArchive, archive);
        long deleted = mongoTemplate.remove(Query.query(Criteria.where(ID).in(ids)), source).getDeletedCount();
        return new SweepResult(archived, deleted);
    }

    private long insertIgnoringDuplicates(List<Document> docs, String archive) {
        if (docs.isEmpty()) {
            return 0;
        }
        try {
            mongoTemplate.insert(docs, archive);
            return docs.size();
        } catch (DuplicateKeyException e) {
            // a concurrent sweep archived part of the batch
            long inserted = 0;
            for (Document d : docs) {
                try {
                    mongoTemplate.insert(d, archive);
                    inserted++;
                } catch (DuplicateKeyException ignored) {
                    log.debug("Document {} already archived in {}", d.get(ID), archive);
                }
            }
            return inserted;
        }
    }

    static Criteria agedCriteria(RetentionPolicy policy, Instant now) {
        String ts = policy.tableClass().timestampField();
        Date cutoff = Date.from(now.minus(policy.maxAge()));
        RetentionPolicy.ExtendedRetention ext = policy.extendedRetention();
        if (ext == null || ext.entities().isEmpty()) {
            return Criteria.where(ts).lt(cutoff);
        }
        String entity = policy.tableClass().entityField();
        Date extendedCutoff = Date.from(now.minus(ext.maxAge()));
        return new Criteria().orOperator(
                Criteria.where(entity).nin(ext.entities()).and(ts).lt(cutoff),
                Criteria.where(entity).in(ext.entities()).and(ts).lt(extendedCutoff));
    }
}
