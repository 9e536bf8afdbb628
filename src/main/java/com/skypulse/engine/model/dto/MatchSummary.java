package com.skypulse.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary text for a match. fromFallback marks the deterministic text used
 * when the language model is unavailable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchSummary {
    private String text;
    private boolean fromFallback;
}
