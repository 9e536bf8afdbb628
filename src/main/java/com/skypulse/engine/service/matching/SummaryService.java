package com.skypulse.engine.service.matching;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.exception.ExternalServiceException;
import com.skypulse.engine.model.dto.MatchSummary;
import com.skypulse.engine.model.dto.ScoreBreakdown;
import com.skypulse.engine.model.dto.SummaryRequest;
import com.skypulse.engine.model.entity.Deal;
import com.skypulse.engine.model.entity.Subscription;
import com.skypulse.engine.port.SummaryClient;
import com.skypulse.engine.util.DataTypeConverter;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * -@Service: Spring bean wrapping the language-model summary collaborator.
 * =========
 * -@Slf4j: Lombok logger generation.
 *
 * GUARANTEES:
 * - The returned Future always succeeds: with the model's text, or with the
 * deterministic fallback text when the model is unavailable
 * - Each attempt is bounded by skypulse.engine.summary.timeout
 * - Attempts are retried by the "summaryService" Retry (3 attempts,
 * exponential backoff with jitter, see application.yml)
 * - The "summaryServiceCB" circuit breaker short-circuits to the fallback
 * while the model is down
 * - Called only after a MatchRecord is committed, never under a route lock
 */
@Service
@Slf4j
public class SummaryService {

    static final String SYSTEM_PROMPT =
            "You are a helpful travel advisor. Be concise, enthusiastic, and focus on value.";

    @Autowired
    private SummaryClient summaryClient;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private RetryRegistry retryRegistry;

    @Autowired
    @Qualifier("summaryRetryScheduler")
    private ScheduledExecutorService summaryRetryScheduler;

    @Autowired
    private EngineProperties properties;

    private CircuitBreaker circuitBreaker;

    private Retry retry;

    /**
     * -@PostConstruct: Resolves the circuit breaker and retry instances.
     *
     * WHY MANUAL (not [@CircuitBreaker]/[@Retry] annotations):
     * --The collaborator returns a Vert.x Future; the AOP proxies only understand
     * CompletionStage and reactive types
     * --The fallback needs the request to build its text, which the manual
     * pattern keeps in scope
     */
    @PostConstruct
    public void init() {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("summaryServiceCB");
        this.retry = retryRegistry.retry("summaryService");
        log.info("SummaryService initialized | CB: {} | Retry: {} (max {} attempts)",
                circuitBreaker.getName(), retry.getName(), retry.getRetryConfig().getMaxAttempts());
    }

    public Future<MatchSummary> summarize(Deal deal, Subscription subscription, ScoreBreakdown breakdown) {
        return summarize(buildRequest(deal, subscription, breakdown));
    }

    public Future<MatchSummary> summarize(SummaryRequest request) {
        log.info("[CB-BEFORE] Summary request for deal {} | State: {}",
                request.getDeal().getId(), circuitBreaker.getState());

        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("[CB-REJECTED] Circuit is OPEN - using fallback summary for deal {}", request.getDeal().getId());
            return Future.succeededFuture(fallback(request));
        }

        long start = System.nanoTime();
        Promise<MatchSummary> promise = Promise.promise();

        CompletionStage<String> attempts = retry.executeCompletionStage(summaryRetryScheduler,
                () -> attempt(request));

        attempts.whenComplete((text, error) -> {
            long duration = System.nanoTime() - start;
            if (error == null) {
                circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
                promise.complete(new MatchSummary(text.trim(), false));
            } else {
                circuitBreaker.onError(duration, TimeUnit.NANOSECONDS, error);
                log.error("Summary generation failed for deal {} - using fallback. Cause: {}",
                        request.getDeal().getId(), error.getMessage());
                promise.complete(fallback(request));
            }
        });

        return promise.future();
    }

    /**
     * One bounded attempt. Blank text counts as a failure so it is retried.
     */
    private CompletionStage<String> attempt(SummaryRequest request) {
        long timeoutMillis = properties.getSummary().getTimeout().toMillis();
        try {
            return summaryClient.generate(request)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .thenApply(text -> {
                        if (text == null || text.trim().isEmpty()) {
                            throw new ExternalServiceException("Empty summary for deal " + request.getDeal().getId());
                        }
                        return text;
                    });
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public SummaryRequest buildRequest(Deal deal, Subscription subscription, ScoreBreakdown breakdown) {
        String prompt = "You are a travel advisor. Explain why this flight deal is good for the user.\n\n"
                + "User's request: \"" + nullToEmpty(subscription.getPrompt()) + "\"\n\n"
                + "Deal details:\n"
                + "- Route: " + deal.getRoute() + "\n"
                + "- Price: $" + DataTypeConverter.formatPrice(deal.getPrice())
                + (deal.getCurrency() != null ? " " + deal.getCurrency() : "") + "\n"
                + "- Airline: " + nullToEmpty(deal.getAirline()) + "\n"
                + "- Dates: " + deal.getDepartureDate() + " to " + deal.getReturnDate() + "\n\n"
                + String.format("Match breakdown: destination %.0f, price %.0f, dates %.0f, origin %.0f%n%n",
                        breakdown.getDestination(), breakdown.getPrice(), breakdown.getDate(), breakdown.getOrigin())
                + "Write a brief, enthusiastic 2-3 sentence summary explaining why this is a great match.\n"
                + "Focus on value, convenience, and how it meets their needs.";

        return new SummaryRequest(deal, subscription.getPrompt(), subscription.getDestination(), breakdown,
                prompt, SYSTEM_PROMPT);
    }

    /**
     * Deterministic text: identical requests always yield identical fallbacks.
     */
    public MatchSummary fallback(SummaryRequest request) {
        String destination = request.getSubscriptionDestination();
        String text = "Great deal on " + request.getDeal().getRoute()
                + " for $" + DataTypeConverter.formatPrice(request.getDeal().getPrice())
                + "! This matches your search for "
                + (destination == null || destination.trim().isEmpty() ? "travel deals" : destination) + ".";
        return new MatchSummary(text, true);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
