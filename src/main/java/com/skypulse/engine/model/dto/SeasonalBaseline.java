package com.skypulse.engine.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Historical same-bucket mean for a route and the current price's deviation
 * from it.
 *
 * baselineMean and deviationFromBaseline are null when no retained
 * observation falls in the bucket (insufficient data, not an error).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalBaseline {
    private LocalDate asOfDate;
    private Season bucket;
    private Double currentPrice;
    private Double baselineMean;
    private Double deviationFromBaseline;
    private int sampleCount;

    @JsonIgnore
    public boolean hasBaseline() {
        return baselineMean != null && deviationFromBaseline != null;
    }
}
