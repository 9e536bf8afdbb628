package com.skypulse.engine.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A user's standing search criteria. Read-only to the engine.
 *
 * Every criterion is optional: an unset field is "no constraint" and earns
 * the full weight of its sub-score.
 */
@Data
public class Subscription {
    private String id;
    private String userRef;

    /**
     * Original natural-language request ("Flights to Paris under $500 in
     * April"), forwarded to the language model as context for the summary
     */
    private String prompt;

    private String origin;
    private String destination;
    private BigDecimal maxPrice;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean active;

    public boolean hasDateWindow() {
        return startDate != null || endDate != null;
    }
}
