package com.skypulse.engine.service.price;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.TrendAnalysis;
import com.skypulse.engine.model.dto.TrendDirection;
import com.skypulse.engine.model.entity.PricePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Short-term direction of a route's prices.
 *
 * - Short window: the newest skypulse.engine.trend.short-window points (7),
 * or every point when the history is shorter
 * - Baseline: mean of the points before the short window; when none remain,
 * the short window itself (delta 0, stable)
 * - delta = (shortMean - baselineMean) / baselineMean; rising above
 * +stable-band, falling below -stable-band, stable otherwise
 * - volatility: coefficient of variation over the whole retained series
 * - Fewer than two points: stable, volatility 0
 */
@Component
@Slf4j
public class TrendAnalyzer {

    @Autowired
    private EngineProperties properties;

    @Autowired
    private PriceHistoryStore historyStore;

    @Autowired
    private RouteLockRegistry routeLocks;

    public TrendAnalysis classify(Route route) {
        return routeLocks.withLock(route, () -> {
            TrendAnalysis analysis = classify(historyStore.all(route));
            log.debug("Trend on {}: {} (delta {}, volatility {}, {} points)", route,
                    analysis.getDirection(), analysis.getDelta(), analysis.getVolatility(), analysis.getSampleCount());
            return analysis;
        });
    }

    /**
     * Classifies an ordered series (oldest first).
     */
    public TrendAnalysis classify(List<PricePoint> points) {
        int n = points.size();
        if (n < 2) {
            return TrendAnalysis.insufficient(n);
        }

        List<Double> prices = PriceMath.prices(points);
        int shortSize = Math.min(properties.getTrend().getShortWindow(), n);
        List<Double> shortWindow = prices.subList(n - shortSize, n);
        List<Double> baseline = shortSize < n ? prices.subList(0, n - shortSize) : shortWindow;
        double shortMean = PriceMath.mean(shortWindow);
        double baselineMean = PriceMath.mean(baseline);

        double delta = baselineMean == 0.0 ? 0.0 : (shortMean - baselineMean) / baselineMean;
        double band = properties.getTrend().getStableBand();

        TrendDirection direction;
        if (delta > band) {
            direction = TrendDirection.RISING;
        } else if (delta < -band) {
            direction = TrendDirection.FALLING;
        } else {
            direction = TrendDirection.STABLE;
        }

        return new TrendAnalysis(direction, PriceMath.volatility(prices), delta, n);
    }
}
