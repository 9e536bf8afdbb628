package com.skypulse.engine.util;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Event Bus Logger
 *
 * Logs the events the engine publishes for external dispatchers.
 * - "price.alert.triggered": alertId, userRef, route, targetPrice, triggeredPrice
 * - "deal.match.created": matchId, dealId, subscriptionId, score
 *
 * =========
 * -@Component: Spring-managed bean registering the consumers at startup.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Component
@Slf4j
public class EventBusLogger {

    @Autowired
    private Vertx vertx;

    /**
     * -@PostConstruct: Registers the logging consumers once Vert.x is injected.
     * --WithoutIT: outgoing notifications would leave no trace in the engine log.
     */
    @PostConstruct
    public void registerEventBusConsumer() {
        vertx.eventBus().<JsonObject>consumer(EngineEvents.ALERT_TRIGGERED, message -> {
            JsonObject payload = message.body();
            log.info("[EventBus-Alert] Alert {} for user {} on {} triggered at {} (target {})",
                    payload.getString("alertId"),
                    payload.getString("userRef"),
                    payload.getString("route"),
                    payload.getString("triggeredPrice"),
                    payload.getString("targetPrice"));
        });

        vertx.eventBus().<JsonObject>consumer(EngineEvents.MATCH_CREATED, message -> {
            JsonObject payload = message.body();
            log.info("[EventBus-Match] Match {} deal {} / subscription {} scored {}",
                    payload.getString("matchId"),
                    payload.getString("dealId"),
                    payload.getString("subscriptionId"),
                    payload.getInteger("score"));
        });

        log.info("EventBusLogger registered on '{}' and '{}'",
                EngineEvents.ALERT_TRIGGERED, EngineEvents.MATCH_CREATED);
    }
}
