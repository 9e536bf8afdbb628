package com.skypulse.engine.repository;

import com.skypulse.engine.exception.PersistenceException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.entity.Subscription;
import com.skypulse.engine.port.SubscriptionStore;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * -@Repository: Read-only adapter over the "subscriptions" collection.
 * --Returns every active subscription as a candidate for the route; origin
 * and destination are scored by MatchScorer, never filtered here
 * --WithoutIT: a subscription failing one location field would never reach
 * the aggregate threshold even when its total score clears it.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Repository
@Slf4j
public class MongoSubscriptionStore implements SubscriptionStore {

    static final String COLLECTION = "subscriptions";

    @Autowired
    private MongoClient mongoClient;

    @Override
    public Future<List<Subscription>> activeSubscriptionsForRoute(Route route) {
        JsonObject query = new JsonObject().put("active", true);

        return mongoClient.find(COLLECTION, query)
                .recover(error -> {
                    log.error("MongoDB error loading subscriptions for {}", route, error);
                    return Future.failedFuture(
                            new PersistenceException("Could not load subscriptions for " + route, error));
                })
                .map(docs -> {
                    List<Subscription> candidates = docs.stream()
                            .map(this::mapToSubscription)
                            .collect(Collectors.toList());
                    log.debug("{} active subscription(s) to score against {}", candidates.size(), route);
                    return candidates;
                });
    }

    Subscription mapToSubscription(JsonObject doc) {
        Subscription subscription = new Subscription();
        subscription.setId(MongoDocuments.id(doc));
        subscription.setUserRef(doc.getString("userRef"));
        subscription.setPrompt(doc.getString("prompt"));
        subscription.setOrigin(doc.getString("origin"));
        subscription.setDestination(doc.getString("destination"));
        subscription.setMaxPrice(MongoDocuments.price(doc, "maxPrice"));
        subscription.setStartDate(MongoDocuments.day(doc, "startDate"));
        subscription.setEndDate(MongoDocuments.day(doc, "endDate"));
        subscription.setActive(doc.getBoolean("active", false));
        return subscription;
    }
}
