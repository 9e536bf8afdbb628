package com.skypulse.engine.service;

import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.entity.Deal;
import com.skypulse.engine.model.entity.MatchRecord;
import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.service.matching.DealMatchingService;
import com.skypulse.engine.service.price.PriceIntelligenceService;
import com.skypulse.engine.util.DataTypeConverter;
import com.skypulse.engine.util.EngineEvents;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * -@Service: Event bus entry point of the engine.
 * --"deal.ingested": normalized deal JSON, handed to DealMatchingService
 * --"price.observed": {origin, destination, price, observedAt}, handed to
 * PriceIntelligenceService
 * --Each message is answered: a reply on success, message.fail() otherwise
 * --WithoutIT: the ingest adapter would have no way to reach the engine.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Service
@Slf4j
public class IngestEventConsumer {

    static final int INVALID_INPUT = 400;
    static final int PROCESSING_FAILED = 500;

    @Autowired
    private Vertx vertx;

    @Autowired
    private DealMatchingService dealMatchingService;

    @Autowired
    private PriceIntelligenceService priceIntelligenceService;

    /**
     * -@PostConstruct: Registers both consumers once the services are injected.
     * --WithoutIT: nothing would listen on the ingest addresses.
     */
    @PostConstruct
    public void registerEventBusConsumers() {
        vertx.eventBus().<JsonObject>consumer(EngineEvents.DEAL_INGESTED, this::onDealIngested);
        vertx.eventBus().<JsonObject>consumer(EngineEvents.PRICE_OBSERVED, this::onPriceObserved);

        log.info("IngestEventConsumer registered to listen on '{}' and '{}'",
                EngineEvents.DEAL_INGESTED, EngineEvents.PRICE_OBSERVED);
    }

    void onDealIngested(Message<JsonObject> message) {
        Deal deal;
        try {
            deal = mapToDeal(message.body());
        } catch (RuntimeException e) {
            log.warn("[EventBus] Unreadable deal on '{}': {}", EngineEvents.DEAL_INGESTED, e.getMessage());
            message.fail(INVALID_INPUT, "Unreadable deal: " + e.getMessage());
            return;
        }

        dealMatchingService.processDeal(deal).onComplete(ar -> {
            if (ar.succeeded()) {
                message.reply(new JsonObject()
                        .put("dealId", deal.getId())
                        .put("matches", ar.result().size())
                        .put("matchIds", new JsonArray(ar.result().stream()
                                .map(MatchRecord::getId)
                                .collect(Collectors.toList()))));
            } else {
                message.fail(PROCESSING_FAILED, ar.cause().getMessage());
            }
        });
    }

    void onPriceObserved(Message<JsonObject> message) {
        JsonObject body = message.body();
        Route route;
        BigDecimal price;
        Instant observedAt;
        try {
            route = Route.of(body.getString("origin"), body.getString("destination"));
            price = DataTypeConverter.toBigDecimal(body.getValue("price"));
            observedAt = body.containsKey("observedAt")
                    ? DataTypeConverter.toInstant(body.getString("observedAt"))
                    : Instant.now();
        } catch (RuntimeException e) {
            log.warn("[EventBus] Unreadable price observation on '{}': {}",
                    EngineEvents.PRICE_OBSERVED, e.getMessage());
            message.fail(INVALID_INPUT, "Unreadable price observation: " + e.getMessage());
            return;
        }

        priceIntelligenceService.recordObservation(route, price, observedAt).onComplete(ar -> {
            if (ar.succeeded()) {
                message.reply(new JsonObject()
                        .put("route", route.toString())
                        .put("action", ar.result().getRecommendation().getAction().name())
                        .put("confidence", ar.result().getRecommendation().getConfidence())
                        .put("triggeredAlerts", new JsonArray(ar.result().getTriggeredAlerts().stream()
                                .map(PriceAlert::getId)
                                .collect(Collectors.toList()))));
            } else {
                int code = ar.cause() instanceof ValidationException ? INVALID_INPUT : PROCESSING_FAILED;
                message.fail(code, ar.cause().getMessage());
            }
        });
    }

    /**
     * Maps the ingest adapter's deal JSON. Dates accept the formats of
     * DataTypeConverter; a missing discoveredAt means "now".
     *
     * @throws DateTimeException     on an unreadable date
     * @throws NumberFormatException on an unreadable price
     */
    Deal mapToDeal(JsonObject doc) {
        Deal deal = new Deal();
        deal.setId(doc.getString("id"));
        deal.setRoute(Route.of(doc.getString("origin"), doc.getString("destination")));
        deal.setPrice(DataTypeConverter.toBigDecimal(doc.getValue("price")));
        deal.setCurrency(doc.getString("currency"));
        deal.setAirline(doc.getString("airline"));
        deal.setDepartureDate(DataTypeConverter.toLocalDate(doc.getString("departureDate")));
        deal.setReturnDate(DataTypeConverter.toLocalDate(doc.getString("returnDate")));
        deal.setBookingLink(doc.getString("bookingLink"));

        Instant discoveredAt = DataTypeConverter.toInstant(doc.getString("discoveredAt"));
        deal.setDiscoveredAt(discoveredAt != null ? discoveredAt : Instant.now());
        return deal;
    }
}
