package com.skypulse.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Yes/no answer to "should I buy now?". shouldBuy is null when the route has
 * no history to decide on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BuyAdvice {
    private Boolean shouldBuy;
    private String reason;
    private Recommendation recommendation;
}
