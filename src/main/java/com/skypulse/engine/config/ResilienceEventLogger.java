package com.skypulse.engine.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resilience Event Logger
 *
 * Logs circuit breaker transitions and retry attempts of the language-model
 * summary path, so a degraded summary can be traced back to the attempts
 * that failed.
 *
 * =========
 * -@Component: Spring-managed bean, discovered by component scanning.
 * =========
 * -@Slf4j: Lombok logger generation.
 * --WithoutIT: retries and circuit transitions would happen silently.
 */
@Component
@Slf4j
public class ResilienceEventLogger {

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private RetryRegistry retryRegistry;

    /**
     * -@PostConstruct: Attaches listeners to every existing instance and to
     * every instance created later (SummaryService creates its own in its
     * [@PostConstruct], which may run after this one).
     */
    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerListeners);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> registerListeners(event.getAddedEntry()));

        retryRegistry.getAllRetries().forEach(this::registerListeners);
        retryRegistry.getEventPublisher()
                .onEntryAdded(event -> registerListeners(event.getAddedEntry()));
    }

    private void registerListeners(CircuitBreaker circuitBreaker) {
        String cbName = circuitBreaker.getName();

        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            log.warn("[{}] STATE TRANSITION: {} -> {}",
                    cbName,
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState());
            logMetrics(circuitBreaker);
        });

        circuitBreaker.getEventPublisher().onCallNotPermitted(event ->
                log.warn("[{}] CALL REJECTED - Circuit is OPEN, fallback summary will be used", cbName));

        circuitBreaker.getEventPublisher().onFailureRateExceeded(event ->
                log.warn("[{}] FAILURE RATE EXCEEDED! Current: {}%, Threshold: {}%",
                        cbName,
                        String.format("%.2f", event.getFailureRate()),
                        String.format("%.2f", circuitBreaker.getCircuitBreakerConfig().getFailureRateThreshold())));
    }

    private void registerListeners(Retry retry) {
        String retryName = retry.getName();

        retry.getEventPublisher().onRetry(event ->
                log.warn("[{}] RETRY attempt {} in {} ms | Cause: {}",
                        retryName,
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())));

        retry.getEventPublisher().onError(event ->
                log.error("[{}] EXHAUSTED after {} attempt(s) | Cause: {}",
                        retryName,
                        event.getNumberOfRetryAttempts(),
                        describe(event.getLastThrowable())));

        retry.getEventPublisher().onSuccess(event ->
                log.info("[{}] SUCCEEDED after {} retr(y/ies)", retryName, event.getNumberOfRetryAttempts()));
    }

    private void logMetrics(CircuitBreaker circuitBreaker) {
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();

        log.warn("[{}] State: {} | Failures: {}/{} | Failure Rate: {}% | Not Permitted: {}",
                circuitBreaker.getName(),
                circuitBreaker.getState(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfBufferedCalls(),
                String.format("%.2f", metrics.getFailureRate()),
                metrics.getNumberOfNotPermittedCalls());
    }

    private String describe(Throwable throwable) {
        if (throwable == null) {
            return "none";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
