package com.skypulse.engine.repository;

import com.skypulse.engine.exception.PersistenceException;
import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.port.PriceAlertRepository;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Mongo adapter for alerts (collection "price_alerts"). save() is an upsert
 * by alert id, so each state change overwrites the previous one.
 */
@Repository
@Slf4j
public class MongoPriceAlertRepository implements PriceAlertRepository {

    static final String COLLECTION = "price_alerts";

    @Autowired
    private MongoClient mongoClient;

    @Override
    public Future<PriceAlert> save(PriceAlert alert) {
        return mongoClient.save(COLLECTION, toDocument(alert))
                .map(id -> alert)
                .recover(error -> {
                    log.error("MongoDB error saving alert {}", alert.getId(), error);
                    return Future.failedFuture(
                            new PersistenceException("Could not save alert " + alert.getId(), error));
                });
    }

    JsonObject toDocument(PriceAlert alert) {
        return new JsonObject()
                .put(MongoDocuments.ID, alert.getId())
                .put("userRef", alert.getUserRef())
                .put("origin", alert.getRoute().getOrigin())
                .put("destination", alert.getRoute().getDestination())
                .put("targetPrice", MongoDocuments.price(alert.getTargetPrice()))
                .put("state", alert.getState().name())
                .put("createdAt", MongoDocuments.date(alert.getCreatedAt()))
                .put("triggeredAt", MongoDocuments.date(alert.getTriggeredAt()))
                .put("triggeredPrice", MongoDocuments.price(alert.getTriggeredPrice()));
    }
}
