package com.skypulse.engine.port;

import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.entity.Subscription;
import io.vertx.core.Future;

import java.util.List;

/**
 * Read-only access to users' standing searches.
 */
public interface SubscriptionStore {

    /**
     * Candidate subscriptions for a deal on the route: every active one. Origin
     * and destination count toward the score, they do not exclude a
     * subscription up front.
     */
    Future<List<Subscription>> activeSubscriptionsForRoute(Route route);
}
