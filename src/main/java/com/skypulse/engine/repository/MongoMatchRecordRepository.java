package com.skypulse.engine.repository;

import com.skypulse.engine.exception.PersistenceException;
import com.skypulse.engine.model.dto.ScoreBreakdown;
import com.skypulse.engine.model.entity.MatchRecord;
import com.skypulse.engine.port.MatchRecordRepository;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * -@Repository: Mongo adapter for match records (collection "deal_matches").
 * --Spring translates nothing here: failures are mapped to
 * PersistenceException by hand, since the Vert.x client reports them
 * through the Future
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Repository
@Slf4j
public class MongoMatchRecordRepository implements MatchRecordRepository {

    static final String COLLECTION = "deal_matches";

    @Autowired
    private MongoClient mongoClient;

    @Override
    public Future<MatchRecord> save(MatchRecord record) {
        return mongoClient.save(COLLECTION, toDocument(record))
                .map(id -> record)
                .recover(error -> {
                    log.error("MongoDB error saving match record {}", record.getId(), error);
                    return Future.failedFuture(
                            new PersistenceException("Could not save match record " + record.getId(), error));
                });
    }

    @Override
    public Future<Void> updateSummary(String recordId, String summary, boolean fromFallback) {
        JsonObject query = new JsonObject().put(MongoDocuments.ID, recordId);
        JsonObject update = new JsonObject().put("$set", new JsonObject()
                .put("summary", summary)
                .put("summaryFromFallback", fromFallback)
                .put("summaryUpdatedAt", MongoDocuments.date(Instant.now())));

        return mongoClient.updateCollection(COLLECTION, query, update)
                .recover(error -> Future.failedFuture(
                        new PersistenceException("Could not backfill summary of match record " + recordId, error)))
                .compose(result -> {
                    if (result == null || result.getDocMatched() == 0) {
                        return Future.<Void>failedFuture(
                                new PersistenceException("Match record not found: " + recordId, null));
                    }
                    return Future.<Void>succeededFuture();
                });
    }

    JsonObject toDocument(MatchRecord record) {
        ScoreBreakdown breakdown = record.getBreakdown();
        JsonObject doc = new JsonObject()
                .put(MongoDocuments.ID, record.getId())
                .put("dealId", record.getDealId())
                .put("subscriptionId", record.getSubscriptionId())
                .put("totalScore", record.getTotalScore())
                .put("createdAt", MongoDocuments.date(record.getCreatedAt()))
                .put("summary", record.getSummary())
                .put("summaryFromFallback", record.isSummaryFromFallback());
        if (breakdown != null) {
            doc.put("breakdown", new JsonObject()
                    .put("destination", breakdown.getDestination())
                    .put("price", breakdown.getPrice())
                    .put("date", breakdown.getDate())
                    .put("origin", breakdown.getOrigin()));
        }
        return doc;
    }
}
