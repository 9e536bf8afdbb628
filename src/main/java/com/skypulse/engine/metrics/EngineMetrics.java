package com.skypulse.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * -@Component: Engine counters on the Micrometer registry.
 * --Exposed through the actuator "metrics" endpoint
 * --WithoutIT: engine activity would only be visible in the log.
 */
@Component
public class EngineMetrics {

    public static final String MATCHES_CREATED = "skypulse.matches.created";
    public static final String SUMMARIES = "skypulse.summaries";
    public static final String ALERTS_TRIGGERED = "skypulse.alerts.triggered";
    public static final String OBSERVATIONS = "skypulse.price.observations";

    @Autowired
    private MeterRegistry meterRegistry;

    public void matchCreated() {
        meterRegistry.counter(MATCHES_CREATED).increment();
    }

    /**
     * Summary attached to a match, tagged source=model or source=fallback.
     */
    public void summaryGenerated(boolean fromFallback) {
        meterRegistry.counter(SUMMARIES, "source", fromFallback ? "fallback" : "model").increment();
    }

    public void alertTriggered() {
        meterRegistry.counter(ALERTS_TRIGGERED).increment();
    }

    public void observationRecorded() {
        meterRegistry.counter(OBSERVATIONS).increment();
    }
}
