package com.skypulse.engine.model.dto;

import com.skypulse.engine.model.Route;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * -@Data / -@NoArgsConstructor: Lombok boilerplate plus the no-arg
 * constructor Jackson needs when the Redis cache deserializes the latest
 * recommendation.
 * --WithoutIT: cache.get(key, Recommendation.class) would fail to rebuild
 * ---the cached value.
 *
 * Latest-wins: recomputed on demand or after each new PricePoint, never kept
 * as history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {
    private Route route;
    private RecommendationAction action;
    private double confidence;
    private List<String> reasoningTags;
    private Instant computedAt;

    // Inputs that produced the verdict, kept for auditing
    private TrendDirection trend;
    private double volatility;
    private Double seasonalDeviation;
}
