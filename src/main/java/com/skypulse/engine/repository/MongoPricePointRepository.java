package com.skypulse.engine.repository;

import com.skypulse.engine.exception.PersistenceException;
import com.skypulse.engine.model.entity.PricePoint;
import com.skypulse.engine.port.PricePointRepository;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Mongo adapter for observed prices (collection "price_points"). One
 * document per observation; Mongo assigns the id.
 */
@Repository
@Slf4j
public class MongoPricePointRepository implements PricePointRepository {

    static final String COLLECTION = "price_points";

    @Autowired
    private MongoClient mongoClient;

    @Override
    public Future<PricePoint> save(PricePoint point) {
        return mongoClient.insert(COLLECTION, toDocument(point))
                .map(id -> point)
                .recover(error -> {
                    log.error("MongoDB error saving price point on {}", point.getRoute(), error);
                    return Future.failedFuture(
                            new PersistenceException("Could not save price point on " + point.getRoute(), error));
                });
    }

    JsonObject toDocument(PricePoint point) {
        return new JsonObject()
                .put("origin", point.getRoute().getOrigin())
                .put("destination", point.getRoute().getDestination())
                .put("routeKey", point.getRoute().getCacheKey())
                .put("price", MongoDocuments.price(point.getPrice()))
                .put("observedAt", MongoDocuments.date(point.getObservedAt()))
                .put("sequence", point.getSequence());
    }
}
