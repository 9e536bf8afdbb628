package com.skypulse.engine.service.price;

import com.skypulse.engine.config.CacheConfig;
import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.metrics.EngineMetrics;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.BuyAdvice;
import com.skypulse.engine.model.dto.ObservationResult;
import com.skypulse.engine.model.dto.Recommendation;
import com.skypulse.engine.model.dto.RecommendationAction;
import com.skypulse.engine.model.dto.RouteStatistics;
import com.skypulse.engine.model.dto.Season;
import com.skypulse.engine.model.dto.SeasonalBaseline;
import com.skypulse.engine.model.dto.SeasonalPattern;
import com.skypulse.engine.model.dto.TrendAnalysis;
import com.skypulse.engine.model.entity.PriceAlert;
import com.skypulse.engine.model.entity.PricePoint;
import com.skypulse.engine.port.PriceAlertRepository;
import com.skypulse.engine.port.PricePointRepository;
import com.skypulse.engine.util.DataTypeConverter;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * -@Service: Entry point of the price-intelligence side of the engine.
 * --Composes PriceHistoryStore, TrendAnalyzer, SeasonalPatternDetector,
 * RecommendationEngine and AlertManager behind one API
 * --WithoutIT: IngestEventConsumer would have to coordinate the route lock
 * ---and the persistence writes itself.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Service
@Slf4j
public class PriceIntelligenceService {

    @Autowired
    private PriceHistoryStore historyStore;

    @Autowired
    private TrendAnalyzer trendAnalyzer;

    @Autowired
    private SeasonalPatternDetector seasonalPatternDetector;

    @Autowired
    private RecommendationEngine recommendationEngine;

    @Autowired
    private AlertManager alertManager;

    @Autowired
    private RouteLockRegistry routeLocks;

    @Autowired
    private PricePointRepository pricePointRepository;

    @Autowired
    private PriceAlertRepository priceAlertRepository;

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private EngineMetrics metrics;

    /**
     * Records one observed price.
     *
     * FLOW:
     * 1. Under the route lock: append, evaluate alerts, recompute the
     * recommendation (so no reader sees a half-applied observation)
     * 2. Outside the lock: refresh the "recommendations" cache (latest wins)
     * 3. Persist the point and the snapshots of the alerts that fired, in
 * PARALLEL
     *
     * -@return Future failing with ValidationException for a malformed
     * observation (nothing is recorded), or PersistenceException when a
     * write fails (the in-memory state is already updated)
     */
    public Future<ObservationResult> recordObservation(Route route, BigDecimal price, Instant observedAt) {
        if (route == null || !route.isComplete()) {
            log.warn("Rejected price observation without a complete route");
            return Future.failedFuture(new ValidationException("Price observation has no complete route"));
        }

        ObservationResult result;
        try {
            result = routeLocks.withLock(route, () -> {
                PricePoint point = historyStore.append(route, price, observedAt);
                List<PriceAlert> triggered = alertManager.evaluate(route, price, observedAt);
                Recommendation recommendation = recommendationEngine.recommend(route, price,
                        DataTypeConverter.toUtcDate(observedAt));
                return new ObservationResult(point, triggered, recommendation);
            });
        } catch (ValidationException e) {
            log.warn("Rejected price observation on {}: {}", route, e.getMessage());
            return Future.failedFuture(e);
        }

        log.info("Observed {} on {} | {} alert(s) triggered | recommendation {} ({})",
                price, route, result.getTriggeredAlerts().size(), result.getRecommendation().getAction(),
                String.format("%.2f", result.getRecommendation().getConfidence()));

        metrics.observationRecorded();
        cacheRecommendation(result.getRecommendation());

        Future<PricePoint> pointSaved = pricePointRepository.save(result.getPoint());
        List<Future<PriceAlert>> alertsSaved = result.getTriggeredAlerts().stream()
                .map(priceAlertRepository::save)
                .collect(Collectors.toList());

        return Future.all(pointSaved, Future.all(alertsSaved))
                .map(cf -> result)
                .onFailure(error -> log.error("Failed to persist observation on {}", route, error));
    }

    public TrendAnalysis trend(Route route) {
        return trendAnalyzer.classify(route);
    }

    public SeasonalBaseline seasonalBaseline(Route route, LocalDate asOfDate) {
        return seasonalPatternDetector.seasonalBaseline(route, asOfDate);
    }

    public Map<Season, SeasonalPattern> seasonalPatterns(Route route) {
        return seasonalPatternDetector.seasonalPatterns(route);
    }

    /**
     * Computes a fresh recommendation and stores it as the route's latest.
     */
    public Recommendation recommend(Route route, BigDecimal currentPrice) {
        Recommendation recommendation = recommendationEngine.recommend(route, currentPrice);
        cacheRecommendation(recommendation);
        return recommendation;
    }

    /**
     * Latest recommendation computed for the route, if still cached.
     */
    public Optional<Recommendation> latestRecommendation(Route route) {
        try {
            Cache cache = cacheManager.getCache(CacheConfig.RECOMMENDATIONS_CACHE);
            if (cache == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(cache.get(route.getCacheKey(), Recommendation.class));
        } catch (RuntimeException e) {
            log.warn("Recommendation cache unavailable for {}: {}", route, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Descriptive statistics over the retained history. Price fields are
     * null and sampleCount is 0 for a route without history.
     */
    public RouteStatistics statistics(Route route) {
        return routeLocks.withLock(route, () -> {
            List<PricePoint> points = historyStore.all(route);
            RouteStatistics stats = new RouteStatistics();
            stats.setRoute(route);
            stats.setSampleCount(points.size());
            stats.setTrend(trendAnalyzer.classify(points).getDirection());
            if (points.isEmpty()) {
                return stats;
            }

            List<Double> prices = PriceMath.prices(points);
            stats.setCurrentPrice(prices.get(prices.size() - 1));
            stats.setAveragePrice(PriceMath.mean(prices));
            stats.setMinPrice(prices.stream().mapToDouble(Double::doubleValue).min().orElse(0.0));
            stats.setMaxPrice(prices.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
            stats.setMedianPrice(PriceMath.median(prices));
            stats.setVolatility(PriceMath.volatility(prices));
            stats.setLastUpdated(points.get(points.size() - 1).getObservedAt());
            return stats;
        });
    }

    /**
     * Buy-now advice.
     *
     * - No history: undetermined (shouldBuy null)
     * - Newest price at or under targetPrice: buy
     * - Otherwise: buy only when the recommendation says BUY
     */
    public BuyAdvice shouldBuy(Route route, BigDecimal targetPrice) {
        Optional<PricePoint> latest = historyStore.latest(route);
        if (latest.isEmpty()) {
            return new BuyAdvice(null, "Not enough data", null);
        }

        BigDecimal current = latest.get().getPrice();
        Recommendation recommendation = recommend(route, current);

        if (targetPrice != null && current.compareTo(targetPrice) <= 0) {
            return new BuyAdvice(true, "Current price (" + DataTypeConverter.formatPrice(current)
                    + ") is at or below your target (" + DataTypeConverter.formatPrice(targetPrice) + ")",
                    recommendation);
        }

        boolean buy = recommendation.getAction() == RecommendationAction.BUY;
        String reason = recommendation.getAction().name().toLowerCase()
                + " (confidence " + String.format("%.2f", recommendation.getConfidence()) + "): "
                + String.join(", ", recommendation.getReasoningTags());
        return new BuyAdvice(buy, reason, recommendation);
    }

    /**
     * Creates an ARMED alert and persists it.
     */
    public Future<PriceAlert> createAlert(Route route, String userRef, BigDecimal targetPrice) {
        PriceAlert alert;
        try {
            alert = alertManager.create(route, userRef, targetPrice);
        } catch (ValidationException e) {
            log.warn("Rejected alert for user {} on {}: {}", userRef, route, e.getMessage());
            return Future.failedFuture(e);
        }
        return priceAlertRepository.save(alert);
    }

    /**
     * Explicit TRIGGERED -> ARMED transition, persisted when it happens.
     *
     * -@return Future with false when the alert was already armed
     */
    public Future<Boolean> rearmAlert(String alertId) {
        boolean rearmed;
        try {
            rearmed = alertManager.rearm(alertId);
        } catch (ValidationException e) {
            return Future.failedFuture(e);
        }
        if (!rearmed) {
            return Future.succeededFuture(false);
        }
        return priceAlertRepository.save(alertManager.snapshot(alertId).orElseThrow())
                .map(saved -> true);
    }

    public List<PriceAlert> activeAlerts(Route route) {
        return alertManager.activeAlerts(route);
    }

    public List<PriceAlert> activeAlerts() {
        return alertManager.activeAlerts();
    }

    private void cacheRecommendation(Recommendation recommendation) {
        try {
            Cache cache = cacheManager.getCache(CacheConfig.RECOMMENDATIONS_CACHE);
            if (cache != null) {
                cache.put(recommendation.getRoute().getCacheKey(), recommendation);
                log.debug("Cached recommendation for {}", recommendation.getRoute());
            }
        } catch (RuntimeException e) {
            // Cache is best effort; the observation itself is already recorded
            log.warn("Could not cache recommendation for {}: {}", recommendation.getRoute(), e.getMessage());
        }
    }
}
