package com.skypulse.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weighted sub-scores of one (deal, subscription) pair. Each component is
 * already multiplied by its weight, so the sum is the raw total.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private double destination;
    private double price;
    private double date;
    private double origin;

    public double sum() {
        return destination + price + date + origin;
    }
}
