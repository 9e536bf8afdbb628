package com.skypulse.engine.model.dto;

import lombok.Value;

/**
 * Result of MatchScorer.score(). matched is totalScore >= threshold
 * (inclusive).
 */
@Value
public class MatchScore {
    int totalScore;
    ScoreBreakdown breakdown;
    boolean matched;
}
