package com.skypulse.engine.model.dto;

import com.skypulse.engine.model.entity.Deal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured input for the language-model summary collaborator:
 * the deal, the subscriber's original request and the score breakdown,
 * plus the rendered prompts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SummaryRequest {
    private Deal deal;
    private String subscriptionPrompt;
    private String subscriptionDestination;
    private ScoreBreakdown scoreBreakdown;
    private String prompt;
    private String systemPrompt;
}
