package com.skypulse.engine.exception;

/**
 * Malformed Deal, Subscription or PriceAlert input.
 *
 * EXTENDS RuntimeException:
 * - Thrown from MatchScorer, PriceHistoryStore and AlertManager
 * - Never fatal to a batch: callers log at WARN and skip the offending item
 *
 * WHEN THROWN:
 * - Deal without route or price, or with a non-positive price
 * - Subscription with a non-positive maxPrice or an inverted date window
 * - Alert with targetPrice <= 0
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
