package com.skypulse.engine.service.price;

import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.Recommendation;
import com.skypulse.engine.model.dto.RecommendationAction;
import com.skypulse.engine.model.dto.Season;
import com.skypulse.engine.model.dto.SeasonalBaseline;
import com.skypulse.engine.model.dto.TrendAnalysis;
import com.skypulse.engine.model.dto.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test
 *
 * Decision table (trend x seasonal deviation), volatility adjustment,
 * confidence floor, reasoning tags
 * RequirementCategorized: Core Requirements (Recommendation Engine)
 */
class RecommendationEngineTest {

    private static final Route ROUTE = Route.of("NYC", "Paris");
    private static final LocalDate AS_OF = LocalDate.of(2025, 6, 20);

    private PriceComponents components;

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        components = new PriceComponents();
        engine = components.recommendationEngine;
    }

    private static TrendAnalysis trend(TrendDirection direction, double volatility) {
        return new TrendAnalysis(direction, volatility, 0.0, 20);
    }

    private static SeasonalBaseline deviation(Double deviation) {
        return new SeasonalBaseline(AS_OF, Season.SUMMER, 450.0, deviation == null ? null : 500.0, deviation,
                deviation == null ? 0 : 10);
    }

    private void assertDecision(TrendDirection direction, Double dev, RecommendationAction action,
            double confidence, String... tags) {
        Recommendation recommendation = engine.decide(trend(direction, 0.0), deviation(dev));
        assertEquals(action, recommendation.getAction(), direction + " / " + dev);
        assertEquals(confidence, recommendation.getConfidence(), 1e-9, direction + " / " + dev);
        assertEquals(List.of(tags), recommendation.getReasoningTags(), direction + " / " + dev);
    }

    /**
     * Input: Falling trend with each deviation band, volatility 0
     * ExpectedOut: buy 0.85 / buy 0.65 / wait 0.6 / buy 0.3
     */
    @Test
    void testDecide_FallingRow() {
        assertDecision(TrendDirection.FALLING, -0.2, RecommendationAction.BUY, 0.85,
                "trend-falling", "below-seasonal-baseline");
        assertDecision(TrendDirection.FALLING, 0.0, RecommendationAction.BUY, 0.65,
                "trend-falling", "near-seasonal-baseline");
        assertDecision(TrendDirection.FALLING, 0.1, RecommendationAction.WAIT, 0.6,
                "trend-falling", "above-seasonal-baseline");
        assertDecision(TrendDirection.FALLING, null, RecommendationAction.BUY, 0.3,
                "trend-falling", "insufficient-seasonal-data");
    }

    /**
     * Input: Stable trend with each deviation band
     * ExpectedOut: buy 0.6 / neutral 0.4 / wait / neutral 0.3
     */
    @Test
    void testDecide_StableRow() {
        assertDecision(TrendDirection.STABLE, -0.15, RecommendationAction.BUY, 0.6,
                "trend-stable", "below-seasonal-baseline");
        assertDecision(TrendDirection.STABLE, 0.05, RecommendationAction.NEUTRAL, 0.4,
                "trend-stable", "near-seasonal-baseline");
        assertDecision(TrendDirection.STABLE, 0.25, RecommendationAction.WAIT, 0.7,
                "trend-stable", "above-seasonal-baseline");
        assertDecision(TrendDirection.STABLE, null, RecommendationAction.NEUTRAL, 0.3,
                "trend-stable", "insufficient-seasonal-data");
    }

    /**
     * Input: Rising trend with each deviation band
     * ExpectedOut: wait everywhere; the attractive-price conflict is tagged
     */
    @Test
    void testDecide_RisingRow() {
        assertDecision(TrendDirection.RISING, -0.3, RecommendationAction.WAIT, 0.5,
                "trend-rising", "below-seasonal-baseline", "conflict-price-attractive-trend-unfavorable");
        assertDecision(TrendDirection.RISING, -0.05, RecommendationAction.WAIT, 0.5,
                "trend-rising", "near-seasonal-baseline");
        assertDecision(TrendDirection.RISING, 0.5, RecommendationAction.WAIT, 0.8,
                "trend-rising", "above-seasonal-baseline");
        assertDecision(TrendDirection.RISING, null, RecommendationAction.WAIT, 0.3,
                "trend-rising", "insufficient-seasonal-data");
    }

    /**
     * Input: Deviation exactly at -10% and +10%
     * ExpectedOut: Band edges are inclusive (BELOW and ABOVE)
     */
    @Test
    void testBandOf_EdgesInclusive() {
        assertEquals(RecommendationEngine.DeviationBand.BELOW, RecommendationEngine.bandOf(-0.1, 0.1));
        assertEquals(RecommendationEngine.DeviationBand.ABOVE, RecommendationEngine.bandOf(0.1, 0.1));
        assertEquals(RecommendationEngine.DeviationBand.NEAR, RecommendationEngine.bandOf(0.0999, 0.1));
        assertEquals(RecommendationEngine.DeviationBand.UNKNOWN, RecommendationEngine.bandOf(null, 0.1));
    }

    /**
     * Input: Falling/below with volatility 0.2
     * ExpectedOut: 0.85 * 0.8 = 0.68; no high-volatility tag
     */
    @Test
    void testDecide_VolatilityReducesConfidence() {
        // When
        Recommendation recommendation = engine.decide(trend(TrendDirection.FALLING, 0.2), deviation(-0.2));

        // Then
        assertEquals(0.68, recommendation.getConfidence(), 1e-9);
        assertFalse(recommendation.getReasoningTags().contains("high-volatility"));
    }

    /**
     * Input: Falling/below with volatility 0.7
     * ExpectedOut: Factor bottoms at 0.5 (0.425); tagged high-volatility
     */
    @Test
    void testDecide_HighVolatilityFactorFloor() {
        // When
        Recommendation recommendation = engine.decide(trend(TrendDirection.FALLING, 0.7), deviation(-0.2));

        // Then
        assertEquals(0.425, recommendation.getConfidence(), 1e-9);
        assertTrue(recommendation.getReasoningTags().contains("high-volatility"));
        assertEquals(0.7, recommendation.getVolatility());
    }

    /**
     * Input: Unknown deviation (0.3) with volatility 0.9
     * ExpectedOut: 0.15 raised to the 0.2 floor
     */
    @Test
    void testDecide_ConfidenceFloor() {
        // When
        Recommendation recommendation = engine.decide(trend(TrendDirection.STABLE, 0.9), deviation(null));

        // Then
        assertEquals(RecommendationEngine.MIN_CONFIDENCE, recommendation.getConfidence(), 1e-9);
    }

    /**
     * Input: Trend computed from a single point
     * ExpectedOut: insufficient-price-history tag added
     */
    @Test
    void testDecide_InsufficientHistoryTagged() {
        // When
        Recommendation recommendation = engine.decide(TrendAnalysis.insufficient(1), deviation(null));

        // Then
        assertEquals(RecommendationAction.NEUTRAL, recommendation.getAction());
        assertTrue(recommendation.getReasoningTags().contains("insufficient-price-history"));
    }

    /**
     * Input: Same inputs twice
     * ExpectedOut: Same action, confidence and tags
     */
    @Test
    void testDecide_Deterministic() {
        // When
        Recommendation first = engine.decide(trend(TrendDirection.RISING, 0.3), deviation(-0.12));
        Recommendation second = engine.decide(trend(TrendDirection.RISING, 0.3), deviation(-0.12));

        // Then
        assertEquals(first, second);
    }

    /**
     * Input: Two summer weeks falling 500 -> 400; current price 380
     * ExpectedOut: BUY (falling, below the summer mean), route and
     * computedAt set, confidence reduced by volatility
     */
    @Test
    void testRecommend_FromStoredHistory() {
        // Given
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 1), 500, 500, 500, 500, 500, 500, 500,
                400, 400, 400, 400, 400, 400, 400);

        // When
        Recommendation recommendation = engine.recommend(ROUTE, new BigDecimal("380"), AS_OF);

        // Then
        assertEquals(RecommendationAction.BUY, recommendation.getAction());
        assertEquals(List.of("trend-falling", "below-seasonal-baseline"), recommendation.getReasoningTags());
        assertTrue(recommendation.getConfidence() > 0.7 && recommendation.getConfidence() < 0.85);
        assertEquals(ROUTE, recommendation.getRoute());
        assertNotNull(recommendation.getComputedAt());
        assertEquals(TrendDirection.FALLING, recommendation.getTrend());
    }

    /**
     * Input: Route without any history
     * ExpectedOut: Neutral trend-only fallback at the floor-adjusted 0.3
     */
    @Test
    void testRecommend_NoHistory() {
        // When
        Recommendation recommendation = engine.recommend(ROUTE, new BigDecimal("380"), AS_OF);

        // Then
        assertEquals(RecommendationAction.NEUTRAL, recommendation.getAction());
        assertEquals(0.3, recommendation.getConfidence(), 1e-9);
        assertTrue(recommendation.getReasoningTags().contains("insufficient-seasonal-data"));
        assertTrue(recommendation.getReasoningTags().contains("insufficient-price-history"));
    }

    /**
     * Input: Current price 0
     * ExpectedOut: ValidationException
     */
    @Test
    void testRecommend_NonPositivePriceRejected() {
        assertThrows(ValidationException.class,
                () -> engine.recommend(ROUTE, BigDecimal.ZERO, AS_OF));
    }
}
