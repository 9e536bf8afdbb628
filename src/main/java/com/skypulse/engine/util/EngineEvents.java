package com.skypulse.engine.util;

/**
 * Event bus addresses owned by the engine.
 */
public final class EngineEvents {

    /** In: normalized deal JSON from the ingest adapter */
    public static final String DEAL_INGESTED = "deal.ingested";

    /** In: {origin, destination, price, observedAt} */
    public static final String PRICE_OBSERVED = "price.observed";

    /** Out: one event per Armed -> Triggered transition */
    public static final String ALERT_TRIGGERED = "price.alert.triggered";

    /** Out: a match record was committed */
    public static final String MATCH_CREATED = "deal.match.created";

    private EngineEvents() {
    }
}
