package com.skypulse.engine.model.entity;

import com.skypulse.engine.model.Route;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * -@Data: Lombok annotation for automatic boilerplate code generation.
 * --Generates getters/setters, equals(), hashCode() and toString()
 * --Deals arrive from the ingest adapter and are treated as immutable once
 * scored; the setters only serve the JSON mapping in IngestEventConsumer
 */
@Data
public class Deal {
    private String id;
    private Route route;
    private BigDecimal price;
    private String currency;
    private String airline;

    // Travel-date window; returnDate is null for one-way offers
    private LocalDate departureDate;
    private LocalDate returnDate;

    private String bookingLink;
    private Instant discoveredAt;
}
