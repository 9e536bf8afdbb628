package com.skypulse.engine.service.price;

import com.skypulse.engine.model.entity.PricePoint;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Descriptive statistics over prices. Empty input yields 0.
 */
final class PriceMath {

    private PriceMath() {
    }

    static List<Double> prices(List<PricePoint> points) {
        return points.stream()
                .map(p -> p.getPrice().doubleValue())
                .collect(Collectors.toList());
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * Sample standard deviation (n - 1); 0 below two values.
     */
    static double stdev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = values.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .sum();
        return Math.sqrt(squares / (values.size() - 1));
    }

    /**
     * Coefficient of variation: stdev / mean.
     */
    static double volatility(List<Double> values) {
        double mean = mean(values);
        if (values.size() < 2 || mean == 0.0) {
            return 0.0;
        }
        return stdev(values) / mean;
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = values.stream().sorted().collect(Collectors.toList());
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }
}
