package com.skypulse.engine.exception;

/**
 * Failure or timeout of the language-model summary collaborator.
 *
 * Recovered locally by SummaryService (retry with backoff, circuit breaker,
 * deterministic fallback text). It never reaches the matching pipeline.
 */
public class ExternalServiceException extends RuntimeException {
    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
