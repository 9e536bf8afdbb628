package com.skypulse.engine.model.dto;

import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.model.entity.PricePoint;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one price observation: the stored point, the alerts it
 * triggered and the recomputed recommendation.
 */
@Data
@AllArgsConstructor
public class ObservationResult {
    private PricePoint point;
    private List<PriceAlert> triggeredAlerts;
    private Recommendation recommendation;
}
