package com.skypulse.engine.service.price;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.Recommendation;
import com.skypulse.engine.model.dto.RecommendationAction;
import com.skypulse.engine.model.dto.SeasonalBaseline;
import com.skypulse.engine.model.dto.TrendAnalysis;
import com.skypulse.engine.model.dto.TrendDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Buy / wait / neutral verdict from trend and seasonal position.
 *
 * DECISION TABLE (trend x seasonal deviation band, band = 10%):
 *
 * | trend   | BELOW (<= -10%) | NEAR          | ABOVE (>= +10%) | UNKNOWN      |
 * |---------|-----------------|---------------|-----------------|--------------|
 * | falling | buy 0.85        | buy 0.65      | wait 0.6-0.8    | buy 0.3      |
 * | stable  | buy 0.6         | neutral 0.4   | wait 0.6-0.8    | neutral 0.3  |
 * | rising  | wait 0.5 (*)    | wait 0.5      | wait 0.6-0.8    | wait 0.3     |
 *
 * (*) conflict: attractive price, unfavourable trend; tagged, not hidden.
 * ABOVE scales with the deviation: 0.6 + 0.2 * min(1, (dev - band) / 0.30).
 * UNKNOWN = no same-bucket history, trend-only fallback.
 *
 * The base confidence is then multiplied by max(0.5, 1 - volatility) and
 * kept within [0.2, 1].
 */
@Component
@Slf4j
public class RecommendationEngine {

    static final double MIN_CONFIDENCE = 0.2;
    static final double ABOVE_BASE = 0.6;
    static final double ABOVE_SPAN = 0.2;
    static final double ABOVE_FULL_SCALE = 0.30;

    enum DeviationBand {
        BELOW,
        NEAR,
        ABOVE,
        UNKNOWN
    }

    private static final class Rule {
        private final RecommendationAction action;
        private final double confidence;
        private final List<String> tags;

        private Rule(RecommendationAction action, double confidence, String... tags) {
            this.action = action;
            this.confidence = confidence;
            this.tags = List.of(tags);
        }
    }

    private static final Map<TrendDirection, Map<DeviationBand, Rule>> TABLE = new EnumMap<>(TrendDirection.class);

    static {
        Map<DeviationBand, Rule> falling = new EnumMap<>(DeviationBand.class);
        falling.put(DeviationBand.BELOW, new Rule(RecommendationAction.BUY, 0.85,
                "trend-falling", "below-seasonal-baseline"));
        falling.put(DeviationBand.NEAR, new Rule(RecommendationAction.BUY, 0.65,
                "trend-falling", "near-seasonal-baseline"));
        falling.put(DeviationBand.UNKNOWN, new Rule(RecommendationAction.BUY, 0.3,
                "trend-falling", "insufficient-seasonal-data"));

        Map<DeviationBand, Rule> stable = new EnumMap<>(DeviationBand.class);
        stable.put(DeviationBand.BELOW, new Rule(RecommendationAction.BUY, 0.6,
                "trend-stable", "below-seasonal-baseline"));
        stable.put(DeviationBand.NEAR, new Rule(RecommendationAction.NEUTRAL, 0.4,
                "trend-stable", "near-seasonal-baseline"));
        stable.put(DeviationBand.UNKNOWN, new Rule(RecommendationAction.NEUTRAL, 0.3,
                "trend-stable", "insufficient-seasonal-data"));

        Map<DeviationBand, Rule> rising = new EnumMap<>(DeviationBand.class);
        rising.put(DeviationBand.BELOW, new Rule(RecommendationAction.WAIT, 0.5,
                "trend-rising", "below-seasonal-baseline", "conflict-price-attractive-trend-unfavorable"));
        rising.put(DeviationBand.NEAR, new Rule(RecommendationAction.WAIT, 0.5,
                "trend-rising", "near-seasonal-baseline"));
        rising.put(DeviationBand.UNKNOWN, new Rule(RecommendationAction.WAIT, 0.3,
                "trend-rising", "insufficient-seasonal-data"));

        // ABOVE is trend-independent; its confidence is computed from the deviation
        for (TrendDirection direction : TrendDirection.values()) {
            Map<DeviationBand, Rule> row = direction == TrendDirection.FALLING ? falling
                    : direction == TrendDirection.STABLE ? stable : rising;
            row.put(DeviationBand.ABOVE, new Rule(RecommendationAction.WAIT, ABOVE_BASE,
                    "trend-" + direction.name().toLowerCase(), "above-seasonal-baseline"));
            TABLE.put(direction, row);
        }
    }

    @Autowired
    private EngineProperties properties;

    @Autowired
    private TrendAnalyzer trendAnalyzer;

    @Autowired
    private SeasonalPatternDetector seasonalPatternDetector;

    @Autowired
    private RouteLockRegistry routeLocks;

    /**
     * Recommendation for today's (UTC) seasonal bucket.
     */
    public Recommendation recommend(Route route, BigDecimal currentPrice) {
        return recommend(route, currentPrice, LocalDate.now(ZoneOffset.UTC));
    }

    /**
     * -@param currentPrice price being considered; null means the newest
     * observed price
     * -@throws ValidationException when currentPrice is not positive
     */
    public Recommendation recommend(Route route, BigDecimal currentPrice, LocalDate asOfDate) {
        if (currentPrice != null && currentPrice.signum() <= 0) {
            throw new ValidationException("Current price on " + route + " must be positive: " + currentPrice);
        }
        return routeLocks.withLock(route, () -> {
            TrendAnalysis trend = trendAnalyzer.classify(route);
            SeasonalBaseline seasonal = seasonalPatternDetector.seasonalBaseline(route, asOfDate, currentPrice);

            Recommendation recommendation = decide(trend, seasonal);
            recommendation.setRoute(route);
            recommendation.setComputedAt(Instant.now());

            log.debug("Recommendation on {}: {} ({}) {}", route, recommendation.getAction(),
                    String.format("%.2f", recommendation.getConfidence()), recommendation.getReasoningTags());
            return recommendation;
        });
    }

    /**
     * Table lookup. Deterministic: equal inputs give equal action, confidence
     * and tags. Route and computedAt are left unset.
     */
    public Recommendation decide(TrendAnalysis trend, SeasonalBaseline seasonal) {
        double band = properties.getRecommendation().getDeviationBand();
        Double deviation = seasonal == null ? null : seasonal.getDeviationFromBaseline();
        DeviationBand deviationBand = bandOf(deviation, band);

        Rule rule = TABLE.get(trend.getDirection()).get(deviationBand);

        double confidence = rule.confidence;
        if (deviationBand == DeviationBand.ABOVE) {
            confidence = ABOVE_BASE + ABOVE_SPAN * Math.min(1.0, (deviation - band) / ABOVE_FULL_SCALE);
        }
        confidence *= Math.max(0.5, 1.0 - trend.getVolatility());
        confidence = Math.min(1.0, Math.max(MIN_CONFIDENCE, confidence));

        List<String> tags = new ArrayList<>(rule.tags);
        if (trend.getSampleCount() < 2) {
            tags.add("insufficient-price-history");
        }
        if (trend.getVolatility() > 0.5) {
            tags.add("high-volatility");
        }

        Recommendation recommendation = new Recommendation();
        recommendation.setAction(rule.action);
        recommendation.setConfidence(confidence);
        recommendation.setReasoningTags(tags);
        recommendation.setTrend(trend.getDirection());
        recommendation.setVolatility(trend.getVolatility());
        recommendation.setSeasonalDeviation(deviation);
        return recommendation;
    }

    static DeviationBand bandOf(Double deviation, double band) {
        if (deviation == null) {
            return DeviationBand.UNKNOWN;
        }
        if (deviation <= -band) {
            return DeviationBand.BELOW;
        }
        if (deviation >= band) {
            return DeviationBand.ABOVE;
        }
        return DeviationBand.NEAR;
    }
}
