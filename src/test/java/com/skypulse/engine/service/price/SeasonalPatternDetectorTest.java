package com.skypulse.engine.service.price;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.dto.Season;
import com.skypulse.engine.model.dto.SeasonalBaseline;
import com.skypulse.engine.model.dto.SeasonalPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test
 *
 * Calendar and holiday buckets, same-bucket baselines, per-bucket patterns
 * RequirementCategorized: Core Requirements (Seasonal Pattern Detector)
 */
class SeasonalPatternDetectorTest {

    private static final Route ROUTE = Route.of("NYC", "Paris");

    private PriceComponents components;

    private SeasonalPatternDetector detector;

    @BeforeEach
    void setUp() {
        components = new PriceComponents();
        detector = components.seasonalPatternDetector;
    }

    /**
     * Input: Dates across the year with the default holiday ranges
     * ExpectedOut: Calendar bucket, HOLIDAY inside a range (including the one
     * wrapping over the year end)
     */
    @Test
    void testBucketFor_DefaultCalendar() {
        assertEquals(Season.SUMMER, detector.bucketFor(LocalDate.of(2026, 7, 15)));
        assertEquals(Season.HOLIDAY, detector.bucketFor(LocalDate.of(2026, 7, 25)));
        assertEquals(Season.HOLIDAY, detector.bucketFor(LocalDate.of(2026, 12, 31)));
        assertEquals(Season.HOLIDAY, detector.bucketFor(LocalDate.of(2027, 1, 5)));
        assertEquals(Season.WINTER, detector.bucketFor(LocalDate.of(2027, 1, 6)));
        assertEquals(Season.WINTER, detector.bucketFor(LocalDate.of(2026, 12, 1)));
        assertEquals(Season.SPRING, detector.bucketFor(LocalDate.of(2026, 4, 1)));
        assertEquals(Season.AUTUMN, detector.bucketFor(LocalDate.of(2026, 10, 1)));
    }

    /**
     * Input: 2026-07-15 with a configured holiday range 07-10..07-20
     * ExpectedOut: HOLIDAY wins over SUMMER
     */
    @Test
    void testBucketFor_HolidayTakesPrecedence() {
        // Given
        components.properties.getSeasonal().setHolidays(
                List.of(new EngineProperties.HolidayRange("festival", "07-10", "07-20")));

        // Then
        assertEquals(Season.HOLIDAY, detector.bucketFor(LocalDate.of(2026, 7, 15)));
        assertEquals(Season.HOLIDAY, detector.bucketFor(LocalDate.of(2026, 7, 10)));
        assertEquals(Season.SUMMER, detector.bucketFor(LocalDate.of(2026, 7, 21)));
    }

    /**
     * Input: Summer prices 400 and 600, one spring price; current 450 as of
     * 2026-06-15
     * ExpectedOut: Baseline 500 over 2 samples, deviation -0.1
     */
    @Test
    void testSeasonalBaseline_SameBucketMean() {
        // Given
        components.appendDaily(ROUTE, LocalDate.of(2025, 4, 1), 300);
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 10), 400);
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 20), 600);

        // When
        SeasonalBaseline baseline = detector.seasonalBaseline(ROUTE, LocalDate.of(2026, 6, 15),
                new BigDecimal("450"));

        // Then
        assertEquals(Season.SUMMER, baseline.getBucket());
        assertEquals(500.0, baseline.getBaselineMean(), 1e-9);
        assertEquals(-0.1, baseline.getDeviationFromBaseline(), 1e-9);
        assertEquals(2, baseline.getSampleCount());
        assertTrue(baseline.hasBaseline());
    }

    /**
     * Input: No current price given
     * ExpectedOut: Newest observed price is compared
     */
    @Test
    void testSeasonalBaseline_DefaultsToNewestPrice() {
        // Given
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 10), 400, 600);

        // When
        SeasonalBaseline baseline = detector.seasonalBaseline(ROUTE, LocalDate.of(2025, 6, 12));

        // Then
        assertEquals(600.0, baseline.getCurrentPrice());
        assertEquals(0.2, baseline.getDeviationFromBaseline(), 1e-9);
    }

    /**
     * Input: Only spring history, baseline asked for autumn
     * ExpectedOut: Insufficient data: null mean and deviation, sampleCount 0
     */
    @Test
    void testSeasonalBaseline_NoSameBucketData() {
        // Given
        components.appendDaily(ROUTE, LocalDate.of(2026, 4, 1), 380, 390);

        // When
        SeasonalBaseline baseline = detector.seasonalBaseline(ROUTE, LocalDate.of(2026, 10, 1));

        // Then
        assertEquals(Season.AUTUMN, baseline.getBucket());
        assertNull(baseline.getBaselineMean());
        assertNull(baseline.getDeviationFromBaseline());
        assertEquals(0, baseline.getSampleCount());
        assertEquals(390.0, baseline.getCurrentPrice());
        assertFalse(baseline.hasBaseline());
    }

    /**
     * Input: Route without history
     * ExpectedOut: No current price and no baseline
     */
    @Test
    void testSeasonalBaseline_EmptyHistory() {
        // When
        SeasonalBaseline baseline = detector.seasonalBaseline(ROUTE, LocalDate.of(2026, 10, 1));

        // Then
        assertNull(baseline.getCurrentPrice());
        assertNull(baseline.getBaselineMean());
    }

    /**
     * Input: Summer prices 400 and 600, one spring price 300
     * ExpectedOut: Two buckets with their mean, min, max and count; others
     * absent
     */
    @Test
    void testSeasonalPatterns_PerBucketSummary() {
        // Given
        components.appendDaily(ROUTE, LocalDate.of(2025, 4, 1), 300);
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 10), 400);
        components.appendDaily(ROUTE, LocalDate.of(2025, 6, 20), 600);

        // When
        Map<Season, SeasonalPattern> patterns = detector.seasonalPatterns(ROUTE);

        // Then
        assertEquals(2, patterns.size());
        SeasonalPattern summer = patterns.get(Season.SUMMER);
        assertEquals(500.0, summer.getAveragePrice(), 1e-9);
        assertEquals(400.0, summer.getMinPrice());
        assertEquals(600.0, summer.getMaxPrice());
        assertEquals(2, summer.getSampleCount());
        assertEquals(1, patterns.get(Season.SPRING).getSampleCount());
        assertFalse(patterns.containsKey(Season.AUTUMN));
    }
}
