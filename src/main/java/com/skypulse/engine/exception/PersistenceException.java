package com.skypulse.engine.exception;

/**
 * Store read/write failure.
 *
 * PROPAGATION:
 * - Mongo adapters fail their Future with this exception
 * - DealMatchingService and PriceIntelligenceService pass it on to the caller
 * - Confirmed matches and price points are never dropped silently
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
