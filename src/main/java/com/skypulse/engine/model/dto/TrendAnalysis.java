package com.skypulse.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Short-term price direction and volatility for a route.
 *
 * volatility is the coefficient of variation (stdev / mean) of the whole
 * queried window. delta is (shortWindowMean - baselineMean) / baselineMean;
 * it stays 0 when fewer than two observations exist.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendAnalysis {
    private TrendDirection direction;
    private double volatility;
    private double delta;
    private int sampleCount;

    public static TrendAnalysis insufficient(int sampleCount) {
        return new TrendAnalysis(TrendDirection.STABLE, 0.0, 0.0, sampleCount);
    }
}
