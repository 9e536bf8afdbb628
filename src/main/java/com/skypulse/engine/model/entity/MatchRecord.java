package com.skypulse.engine.model.entity;

import com.skypulse.engine.model.dto.ScoreBreakdown;
import lombok.Data;

import java.time.Instant;

/**
 * -@Data: Lombok annotation for getters/setters, equals(), hashCode() and
 * toString().
 * --Only created for totalScore >= threshold (see DealMatchingService)
 * --Immutable after creation except for the summary backfill
 */
@Data
public class MatchRecord {
    private String id;
    private String dealId;
    private String subscriptionId;
    private int totalScore;
    private ScoreBreakdown breakdown;
    private Instant createdAt;

    /**
     * Null until the language-model summary (or its fallback) is backfilled
     */
    private String summary;

    // Set when the summary text is the deterministic fallback
    private boolean summaryFromFallback;
}
