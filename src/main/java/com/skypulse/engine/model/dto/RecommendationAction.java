package com.skypulse.engine.model.dto;

public enum RecommendationAction {
    BUY,
    WAIT,
    NEUTRAL
}
