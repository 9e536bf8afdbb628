package com.skypulse.engine.service.price;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.Season;
import com.skypulse.engine.model.dto.SeasonalBaseline;
import com.skypulse.engine.model.dto.SeasonalPattern;
import com.skypulse.engine.model.entity.PricePoint;
import com.skypulse.engine.util.DataTypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Seasonal buckets and same-bucket baselines.
 *
 * BUCKETS:
 * - Winter Dec-Feb, Spring Mar-May, Summer Jun-Aug, Autumn Sep-Nov
 * - Holiday: any configured range (skypulse.engine.seasonal.holidays)
 * containing the date; takes precedence over the calendar bucket
 *
 * Points are bucketed by their UTC observation date. The baseline pools
 * every retained year.
 */
@Component
@Slf4j
public class SeasonalPatternDetector {

    @Autowired
    private EngineProperties properties;

    @Autowired
    private PriceHistoryStore historyStore;

    @Autowired
    private RouteLockRegistry routeLocks;

    public Season bucketFor(LocalDate date) {
        MonthDay day = MonthDay.from(date);
        for (EngineProperties.HolidayRange holiday : properties.getSeasonal().getHolidays()) {
            if (holiday.contains(day)) {
                return Season.HOLIDAY;
            }
        }
        switch (date.getMonth()) {
            case DECEMBER:
            case JANUARY:
            case FEBRUARY:
                return Season.WINTER;
            case MARCH:
            case APRIL:
            case MAY:
                return Season.SPRING;
            case JUNE:
            case JULY:
            case AUGUST:
                return Season.SUMMER;
            default:
                return Season.AUTUMN;
        }
    }

    /**
     * Baseline for the bucket of asOfDate, compared against the route's
     * newest observed price.
     */
    public SeasonalBaseline seasonalBaseline(Route route, LocalDate asOfDate) {
        return seasonalBaseline(route, asOfDate, null);
    }

    /**
     * -@param currentPrice price to compare; null means the newest observed
     * price
     * -@return baselineMean and deviationFromBaseline are null when no
     * retained point falls in the same bucket (insufficient data)
     */
    public SeasonalBaseline seasonalBaseline(Route route, LocalDate asOfDate, BigDecimal currentPrice) {
        return routeLocks.withLock(route, () -> {
            Season bucket = bucketFor(asOfDate);
            List<PricePoint> points = historyStore.all(route);

            Double current = null;
            if (currentPrice != null) {
                current = currentPrice.doubleValue();
            } else if (!points.isEmpty()) {
                current = points.get(points.size() - 1).getPrice().doubleValue();
            }

            List<Double> sameBucket = points.stream()
                    .filter(p -> bucketFor(DataTypeConverter.toUtcDate(p.getObservedAt())) == bucket)
                    .map(p -> p.getPrice().doubleValue())
                    .collect(Collectors.toList());

            if (sameBucket.isEmpty()) {
                log.debug("No {} history on {} - seasonal baseline unavailable", bucket, route);
                return new SeasonalBaseline(asOfDate, bucket, current, null, null, 0);
            }

            double mean = PriceMath.mean(sameBucket);
            Double deviation = current == null ? null : (current - mean) / mean;
            return new SeasonalBaseline(asOfDate, bucket, current, mean, deviation, sameBucket.size());
        });
    }

    /**
     * Per-bucket price summary over retained history. Buckets without data
     * are absent.
     */
    public Map<Season, SeasonalPattern> seasonalPatterns(Route route) {
        return routeLocks.withLock(route, () -> {
            Map<Season, List<Double>> byBucket = historyStore.all(route).stream()
                    .collect(Collectors.groupingBy(
                            p -> bucketFor(DataTypeConverter.toUtcDate(p.getObservedAt())),
                            () -> new EnumMap<>(Season.class),
                            Collectors.mapping(p -> p.getPrice().doubleValue(), Collectors.toList())));

            Map<Season, SeasonalPattern> patterns = new EnumMap<>(Season.class);
            byBucket.forEach((season, prices) -> patterns.put(season, new SeasonalPattern(
                    season,
                    PriceMath.mean(prices),
                    prices.stream().mapToDouble(Double::doubleValue).min().orElse(0.0),
                    prices.stream().mapToDouble(Double::doubleValue).max().orElse(0.0),
                    PriceMath.volatility(prices),
                    prices.size())));
            return patterns;
        });
    }
}
