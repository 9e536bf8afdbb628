package com.skypulse.engine.service;

import com.skypulse.engine.exception.PersistenceException;
import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.ObservationResult;
import com.skypulse.engine.model.dto.Recommendation;
import com.skypulse.engine.model.dto.RecommendationAction;
import com.skypulse.engine.model.entity.Deal;
import com.skypulse.engine.model.entity.MatchRecord;
import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.model.entity.PricePoint;
import com.skypulse.engine.service.matching.DealMatchingService;
import com.skypulse.engine.service.price.PriceIntelligenceService;
import com.skypulse.engine.util.EngineEvents;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * TestCategory: Unit Test
 *
 * Event bus entry point: deal and price messages mapped, dispatched and
 * answered (reply or fail code)
 * RequirementCategorized: Core Requirements (Ingest integration, error
 * handling)
 */
@ExtendWith(MockitoExtension.class)
class IngestEventConsumerTest {

    @Mock
    private Vertx vertx;

    @Mock
    private EventBus eventBus;

    @Mock
    private DealMatchingService dealMatchingService;

    @Mock
    private PriceIntelligenceService priceIntelligenceService;

    /**
     * -[@Mock]: Incoming event bus message; the test inspects reply/fail.
     */
    @Mock
    private Message<JsonObject> message;

    @InjectMocks
    private IngestEventConsumer consumer;

    private static JsonObject dealJson() {
        return new JsonObject()
                .put("id", "D-1")
                .put("origin", "NYC")
                .put("destination", "Paris")
                .put("price", "449.00")
                .put("currency", "USD")
                .put("airline", "Air France")
                .put("departureDate", "2026-04-10")
                .put("returnDate", "2026-04-17")
                .put("bookingLink", "https://example.test/book/D-1")
                .put("discoveredAt", "2026-03-01T09:00:00Z");
    }

    /**
     * Input: Bean initialization
     * ExpectedOut: Consumers registered on both ingest addresses
     */
    @Test
    @SuppressWarnings("unchecked")
    void testRegisterEventBusConsumers() {
        // Given
        when(vertx.eventBus()).thenReturn(eventBus);

        // When
        consumer.registerEventBusConsumers();

        // Then
        verify(eventBus).consumer(eq(EngineEvents.DEAL_INGESTED), any(Handler.class));
        verify(eventBus).consumer(eq(EngineEvents.PRICE_OBSERVED), any(Handler.class));
    }

    /**
     * Input: Complete deal JSON
     * ExpectedOut: Every field mapped; price exact
     */
    @Test
    void testMapToDeal() {
        // When
        Deal deal = consumer.mapToDeal(dealJson());

        // Then
        assertEquals("D-1", deal.getId());
        assertEquals(Route.of("NYC", "Paris"), deal.getRoute());
        assertEquals(new BigDecimal("449.00"), deal.getPrice());
        assertEquals("USD", deal.getCurrency());
        assertEquals(LocalDate.of(2026, 4, 10), deal.getDepartureDate());
        assertEquals(LocalDate.of(2026, 4, 17), deal.getReturnDate());
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), deal.getDiscoveredAt());
    }

    /**
     * Input: Deal matched by two subscriptions
     * ExpectedOut: Reply with deal id, match count and ids
     */
    @Test
    void testOnDealIngested_RepliesWithMatches() {
        // Given
        MatchRecord first = new MatchRecord();
        first.setId("M-1");
        MatchRecord second = new MatchRecord();
        second.setId("M-2");
        when(message.body()).thenReturn(dealJson());
        when(dealMatchingService.processDeal(any(Deal.class)))
                .thenReturn(Future.succeededFuture(List.of(first, second)));

        // When
        consumer.onDealIngested(message);

        // Then
        ArgumentCaptor<Object> reply = ArgumentCaptor.forClass(Object.class);
        verify(message).reply(reply.capture());
        JsonObject body = (JsonObject) reply.getValue();
        assertEquals("D-1", body.getString("dealId"));
        assertEquals(2, body.getInteger("matches"));
        assertEquals(new JsonArray().add("M-1").add("M-2"), body.getJsonArray("matchIds"));
    }

    /**
     * Input: Deal with an unreadable price
     * ExpectedOut: fail(400); matching never invoked
     */
    @Test
    void testOnDealIngested_UnreadableDeal() {
        // Given
        when(message.body()).thenReturn(dealJson().put("price", "cheap"));

        // When
        consumer.onDealIngested(message);

        // Then
        verify(message).fail(eq(IngestEventConsumer.INVALID_INPUT), anyString());
        verifyNoInteractions(dealMatchingService);
    }

    /**
     * Input: Matching fails on persistence
     * ExpectedOut: fail(500)
     */
    @Test
    void testOnDealIngested_ProcessingFailure() {
        // Given
        when(message.body()).thenReturn(dealJson());
        when(dealMatchingService.processDeal(any(Deal.class)))
                .thenReturn(Future.failedFuture(new PersistenceException("write failed", null)));

        // When
        consumer.onDealIngested(message);

        // Then
        verify(message).fail(IngestEventConsumer.PROCESSING_FAILED, "write failed");
    }

    /**
     * Input: Price observation that triggers one alert
     * ExpectedOut: Reply with route, action, confidence and alert ids
     */
    @Test
    void testOnPriceObserved_RepliesWithRecommendation() {
        // Given
        Route route = Route.of("NYC", "Paris");
        Instant observedAt = Instant.parse("2026-03-01T12:00:00Z");
        Recommendation recommendation = new Recommendation();
        recommendation.setAction(RecommendationAction.BUY);
        recommendation.setConfidence(0.85);
        PriceAlert alert = new PriceAlert("A-1", route, "user-1", new BigDecimal("400"), observedAt);
        ObservationResult result = new ObservationResult(
                new PricePoint(route, new BigDecimal("399"), observedAt, 1), List.of(alert), recommendation);

        when(message.body()).thenReturn(new JsonObject()
                .put("origin", "NYC").put("destination", "Paris")
                .put("price", 399).put("observedAt", "2026-03-01T12:00:00Z"));
        when(priceIntelligenceService.recordObservation(route, new BigDecimal("399"), observedAt))
                .thenReturn(Future.succeededFuture(result));

        // When
        consumer.onPriceObserved(message);

        // Then
        ArgumentCaptor<Object> reply = ArgumentCaptor.forClass(Object.class);
        verify(message).reply(reply.capture());
        JsonObject body = (JsonObject) reply.getValue();
        assertEquals("NYC → Paris", body.getString("route"));
        assertEquals("BUY", body.getString("action"));
        assertEquals(0.85, body.getDouble("confidence"));
        assertEquals(new JsonArray().add("A-1"), body.getJsonArray("triggeredAlerts"));
    }

    /**
     * Input: Observation rejected by validation
     * ExpectedOut: fail(400)
     */
    @Test
    void testOnPriceObserved_ValidationFailure() {
        // Given
        when(message.body()).thenReturn(new JsonObject()
                .put("origin", "NYC").put("destination", "Paris").put("price", 0));
        when(priceIntelligenceService.recordObservation(any(), any(), any()))
                .thenReturn(Future.failedFuture(new ValidationException("price must be positive")));

        // When
        consumer.onPriceObserved(message);

        // Then
        verify(message).fail(IngestEventConsumer.INVALID_INPUT, "price must be positive");
    }

    /**
     * Input: Unreadable timestamp
     * ExpectedOut: fail(400) before reaching the service
     */
    @Test
    void testOnPriceObserved_UnreadableTimestamp() {
        // Given
        when(message.body()).thenReturn(new JsonObject()
                .put("origin", "NYC").put("destination", "Paris")
                .put("price", 420).put("observedAt", "yesterday"));

        // When
        consumer.onPriceObserved(message);

        // Then
        verify(message).fail(eq(IngestEventConsumer.INVALID_INPUT), anyString());
        verifyNoInteractions(priceIntelligenceService);
    }
}
