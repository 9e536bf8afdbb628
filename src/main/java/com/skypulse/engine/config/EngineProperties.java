package com.skypulse.engine.config;

import com.skypulse.engine.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine Configuration Properties
 *
 * WHY: Binds 'skypulse.engine.*' from application.yml to a type-safe object
 * shared by the scorer, the analytics components and the summary path.
 *
 * GROUPS:
 * - match: sub-score weights, match threshold, location aliases
 * - history: rolling retention per route
 * - trend: short window size and stable band
 * - seasonal: holiday ranges overriding the calendar buckets
 * - recommendation: seasonal deviation band
 * - summary: language-model endpoint and per-attempt timeout
 *
 * =========
 * -@Data: Lombok getters/setters so Spring can bind nested groups.
 * =========
 * -@ConfigurationProperties: Binds the "skypulse.engine" prefix.
 * --Registered through [@ConfigurationPropertiesScan] on Application
 * --Defaults below apply when a key is absent from application.yml
 * --WithoutIT: the engine would run on hardcoded values only.
 */
@Data
@Slf4j
@ConfigurationProperties(prefix = "skypulse.engine")
public class EngineProperties {

    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

    private Match match = new Match();
    private History history = new History();
    private Trend trend = new Trend();
    private Seasonal seasonal = new Seasonal();
    private Recommendation recommendation = new Recommendation();
    private Summary summary = new Summary();

    @Data
    public static class Match {
        private int destinationWeight = 40;
        private int priceWeight = 30;
        private int dateWeight = 20;
        private int originWeight = 10;
        private int threshold = 50;

        /**
         * Alias groups: key and values all name the same place
         * (e.g. nyc -> [new york, new york city])
         */
        private Map<String, List<String>> locationAliases = defaultAliases();

        public int totalWeight() {
            return destinationWeight + priceWeight + dateWeight + originWeight;
        }
    }

    @Data
    public static class History {
        private int retentionDays = 365;
    }

    @Data
    public static class Trend {
        private int shortWindow = 7;
        private double stableBand = 0.05;
    }

    @Data
    public static class Seasonal {
        private List<HolidayRange> holidays = new ArrayList<>(List.of(
                new HolidayRange("year-end", "12-20", "01-05"),
                new HolidayRange("mid-year-peak", "07-20", "08-10")));
    }

    /**
     * Month-day range, inclusive on both ends. start after end means the range
     * wraps over the year end (12-20 .. 01-05).
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HolidayRange {
        private String name;
        private String start;
        private String end;

        public MonthDay startDay() {
            return MonthDay.parse(start, MONTH_DAY);
        }

        public MonthDay endDay() {
            return MonthDay.parse(end, MONTH_DAY);
        }

        public boolean contains(MonthDay day) {
            MonthDay from = startDay();
            MonthDay to = endDay();
            if (!from.isAfter(to)) {
                return !day.isBefore(from) && !day.isAfter(to);
            }
            return !day.isBefore(from) || !day.isAfter(to);
        }
    }

    @Data
    public static class Recommendation {
        private double deviationBand = 0.10;
    }

    @Data
    public static class Summary {
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.2";
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * -@PostConstruct: Runs once binding is complete.
     * --Fails the Spring context before any deal or observation is processed
     * --WithoutIT: a bad weight set would silently skew every score.
     *
     * @throws ConfigurationException on the first invalid setting
     */
    @PostConstruct
    public void validate() {
        if (match.getDestinationWeight() < 0 || match.getPriceWeight() < 0
                || match.getDateWeight() < 0 || match.getOriginWeight() < 0) {
            throw new ConfigurationException("Match weights must not be negative");
        }
        if (match.totalWeight() != 100) {
            throw new ConfigurationException("Match weights must sum to 100 but sum to " + match.totalWeight());
        }
        if (match.getThreshold() < 0 || match.getThreshold() > 100) {
            throw new ConfigurationException("Match threshold must be within 0..100: " + match.getThreshold());
        }
        if (history.getRetentionDays() <= 0) {
            throw new ConfigurationException("History retention must be positive: " + history.getRetentionDays());
        }
        if (trend.getShortWindow() <= 0) {
            throw new ConfigurationException("Trend short window must be positive: " + trend.getShortWindow());
        }
        if (trend.getStableBand() < 0 || recommendation.getDeviationBand() < 0) {
            throw new ConfigurationException("Trend and deviation bands must not be negative");
        }
        if (summary.getTimeout() == null || summary.getTimeout().isNegative() || summary.getTimeout().isZero()) {
            throw new ConfigurationException("Summary timeout must be positive");
        }
        for (HolidayRange range : seasonal.getHolidays()) {
            try {
                range.startDay();
                range.endDay();
            } catch (DateTimeParseException | NullPointerException e) {
                throw new ConfigurationException("Malformed holiday range '" + range.getName()
                        + "': expected MM-dd bounds, got " + range.getStart() + ".." + range.getEnd());
            }
        }
        log.info("Engine configuration validated | weights {}/{}/{}/{} | threshold {} | retention {}d | holidays {}",
                match.getDestinationWeight(), match.getPriceWeight(), match.getDateWeight(),
                match.getOriginWeight(), match.getThreshold(), history.getRetentionDays(),
                seasonal.getHolidays().size());
    }

    private static Map<String, List<String>> defaultAliases() {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        aliases.put("nyc", List.of("new york", "new york city"));
        aliases.put("la", List.of("los angeles"));
        aliases.put("sf", List.of("san francisco"));
        aliases.put("paris", List.of("cdg", "orly"));
        aliases.put("london", List.of("lhr", "lgw", "ltn"));
        aliases.put("tokyo", List.of("nrt", "hnd"));
        return aliases;
    }
}
