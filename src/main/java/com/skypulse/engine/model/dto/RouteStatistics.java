package com.skypulse.engine.model.dto;

import com.skypulse.engine.model.Route;
import lombok.Data;

import java.time.Instant;

/**
 * Summary figures over the retained history of a route. Price fields are
 * null when the route has no history.
 */
@Data
public class RouteStatistics {
    private Route route;
    private Double currentPrice;
    private Double averagePrice;
    private Double minPrice;
    private Double maxPrice;
    private Double medianPrice;
    private double volatility;
    private int sampleCount;
    private TrendDirection trend;
    private Instant lastUpdated;
}
