package com.skypulse.engine.model.dto;

/**
 * Seasonal buckets. HOLIDAY overrides the calendar bucket for the configured
 * holiday ranges.
 */
public enum Season {
    WINTER,
    SPRING,
    SUMMER,
    AUTUMN,
    HOLIDAY
}
