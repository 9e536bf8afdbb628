package com.skypulse.engine.model.dto;

public enum TrendDirection {
    RISING,
    FALLING,
    STABLE
}
