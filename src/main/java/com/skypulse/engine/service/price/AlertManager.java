package com.skypulse.engine.service.price;

import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.metrics.EngineMetrics;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.util.DataTypeConverter;
import com.skypulse.engine.util.EngineEvents;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * -@Component: Price alerts per route and their Armed/Triggered lifecycle.
 *
 * LIFECYCLE:
 * - create(): ARMED
 * - evaluate(): ARMED -> TRIGGERED when price <= targetPrice; an alert that is
 * already TRIGGERED is left untouched
 * - rearm(): TRIGGERED -> ARMED, only on an explicit caller request
 *
 * Each transition to TRIGGERED publishes one "price.alert.triggered" event,
 * built from the state captured under the route lock. Publishing happens when
 * evaluate() leaves its own lock section; a caller already holding the
 * (reentrant) route lock, like the observation pipeline, still holds it
 * while the event is sent. publish() does not wait for consumers.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Component
@Slf4j
public class AlertManager {

    @Autowired
    private RouteLockRegistry routeLocks;

    @Autowired
    private Vertx vertx;

    @Autowired
    private EngineMetrics metrics;

    private final Map<Route, List<PriceAlert>> alertsByRoute = new ConcurrentHashMap<>();

    private final Map<String, PriceAlert> alertsById = new ConcurrentHashMap<>();

    /**
     * @throws ValidationException when the route is incomplete or
     *                             targetPrice is missing or not positive
     */
    public PriceAlert create(Route route, String userRef, BigDecimal targetPrice) {
        if (route == null || !route.isComplete()) {
            throw new ValidationException("Alert has no complete route");
        }
        if (targetPrice == null || targetPrice.signum() <= 0) {
            throw new ValidationException("Alert target price must be positive: " + targetPrice);
        }

        PriceAlert alert = new PriceAlert(UUID.randomUUID().toString(), route, userRef, targetPrice, Instant.now());
        routeLocks.withLock(route, () -> {
            alertsByRoute.computeIfAbsent(route, r -> new ArrayList<>()).add(alert);
            alertsById.put(alert.getId(), alert);
        });

        log.info("Alert {} created for user {} on {} at target {}", alert.getId(), userRef, route, targetPrice);
        return alert;
    }

    /**
     * Offers an observed price to every alert on the route.
     *
     * -@return snapshots of the alerts that transitioned to TRIGGERED on this
     * observation, detached from later rearm() calls
     * -@throws ValidationException when the price is missing or not positive
     */
    public List<PriceAlert> evaluate(Route route, BigDecimal price, Instant observedAt) {
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Observed price on " + route + " must be positive: " + price);
        }
        List<PriceAlert> triggered = new ArrayList<>();
        routeLocks.withLock(route, () -> {
            for (PriceAlert alert : alertsByRoute.getOrDefault(route, List.of())) {
                if (alert.tryTrigger(price, observedAt)) {
                    triggered.add(alert.snapshot());
                }
            }
        });

        for (PriceAlert alert : triggered) {
            log.info("Alert {} TRIGGERED on {} at {} (target {})",
                    alert.getId(), route, price, alert.getTargetPrice());
            metrics.alertTriggered();
            vertx.eventBus().publish(EngineEvents.ALERT_TRIGGERED, alertEvent(alert));
        }
        return triggered;
    }

    /**
     * -@return true if the alert went from TRIGGERED back to ARMED, false if
     * it was already armed
     * -@throws ValidationException for an unknown alert id
     */
    public boolean rearm(String alertId) {
        PriceAlert alert = find(alertId)
                .orElseThrow(() -> new ValidationException("Unknown alert: " + alertId));

        boolean rearmed = routeLocks.withLock(alert.getRoute(), alert::rearm);
        if (rearmed) {
            log.info("Alert {} re-armed on {}", alertId, alert.getRoute());
        } else {
            log.debug("Alert {} already armed - rearm ignored", alertId);
        }
        return rearmed;
    }

    public Optional<PriceAlert> find(String alertId) {
        return Optional.ofNullable(alertId).map(alertsById::get);
    }

    /**
     * Copy of the alert's state read under its route lock.
     */
    public Optional<PriceAlert> snapshot(String alertId) {
        return find(alertId).map(alert -> routeLocks.withLock(alert.getRoute(), alert::snapshot));
    }

    /**
     * Armed alerts on the route.
     */
    public List<PriceAlert> activeAlerts(Route route) {
        return routeLocks.withLock(route, () -> alertsByRoute.getOrDefault(route, List.of()).stream()
                .filter(PriceAlert::isArmed)
                .collect(Collectors.toList()));
    }

    /**
     * Armed alerts on every route.
     */
    public List<PriceAlert> activeAlerts() {
        return alertsByRoute.keySet().stream()
                .flatMap(route -> activeAlerts(route).stream())
                .collect(Collectors.toList());
    }

    private JsonObject alertEvent(PriceAlert alert) {
        return new JsonObject()
                .put("alertId", alert.getId())
                .put("userRef", alert.getUserRef())
                .put("route", alert.getRoute().toString())
                .put("targetPrice", DataTypeConverter.formatPrice(alert.getTargetPrice()))
                .put("triggeredPrice", DataTypeConverter.formatPrice(alert.getTriggeredPrice()))
                .put("triggeredAt", alert.getTriggeredAt().toString());
    }
}
