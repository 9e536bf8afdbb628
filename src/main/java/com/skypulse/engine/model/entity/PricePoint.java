package com.skypulse.engine.model.entity;

import com.skypulse.engine.model.Route;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price observation for a route. Appended, never mutated.
 *
 * sequence is the insertion counter of the owning history; it breaks ties
 * between observations sharing the same observedAt.
 */
@Value
public class PricePoint {
    Route route;
    BigDecimal price;
    Instant observedAt;
    long sequence;
}
