package com.skypulse.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Price profile of one seasonal bucket across all retained years.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalPattern {
    private Season season;
    private double averagePrice;
    private double minPrice;
    private double maxPrice;
    private double volatility;
    private int sampleCount;
}
