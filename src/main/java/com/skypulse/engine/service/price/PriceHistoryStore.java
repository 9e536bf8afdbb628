package com.skypulse.engine.service.price;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.Route;
import com.skypulse.engine.model.entity.PricePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Keyed in-memory time series: route -> price points ordered oldest to newest.
 *
 * RETENTION:
 * - Rolling window of skypulse.engine.history.retention-days (365) per route,
 * measured from that route's newest point
 * - append() prunes eagerly; query() filters again so a point outside the
 * window is never returned
 *
 * ORDERING: by observedAt; equal timestamps keep insertion order.
 *
 * Every operation runs under the route's lock from RouteLockRegistry.
 *
 * =========
 * -@Component: One store per engine process, lifecycle tied to the Spring
 * context.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Component
@Slf4j
public class PriceHistoryStore {

    @Autowired
    private EngineProperties properties;

    @Autowired
    private RouteLockRegistry routeLocks;

    private final Map<Route, List<PricePoint>> series = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    /**
     * @throws ValidationException when the route is incomplete, the price is
     *                             missing or not positive, or the timestamp
     *                             is missing
     */
    public PricePoint append(Route route, BigDecimal price, Instant observedAt) {
        if (route == null || !route.isComplete()) {
            throw new ValidationException("Price observation has no complete route");
        }
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Price observation on " + route + " has no valid price: " + price);
        }
        if (observedAt == null) {
            throw new ValidationException("Price observation on " + route + " has no timestamp");
        }

        return routeLocks.withLock(route, () -> {
            List<PricePoint> points = series.computeIfAbsent(route, r -> new ArrayList<>());
            PricePoint point = new PricePoint(route, price, observedAt, sequence.incrementAndGet());

            // Insert after every point observed at or before this one
            int index = points.size();
            while (index > 0 && points.get(index - 1).getObservedAt().isAfter(observedAt)) {
                index--;
            }
            points.add(index, point);

            int pruned = pruneLocked(points);
            if (pruned > 0) {
                log.debug("Pruned {} point(s) older than {} days on {}",
                        pruned, properties.getHistory().getRetentionDays(), route);
            }
            return point;
        });
    }

    /**
     * Points observed within sinceDays of the route's newest point, oldest
     * first. sinceDays beyond the retention window is capped to it.
     */
    public List<PricePoint> query(Route route, int sinceDays) {
        if (sinceDays <= 0) {
            throw new ValidationException("sinceDays must be positive: " + sinceDays);
        }
        return routeLocks.withLock(route, () -> {
            List<PricePoint> points = series.get(route);
            if (points == null || points.isEmpty()) {
                return List.<PricePoint>of();
            }
            int days = Math.min(sinceDays, properties.getHistory().getRetentionDays());
            Instant from = points.get(points.size() - 1).getObservedAt().minus(Duration.ofDays(days));
            return points.stream()
                    .filter(p -> !p.getObservedAt().isBefore(from))
                    .collect(Collectors.toList());
        });
    }

    /**
     * Every retained point for the route, oldest first.
     */
    public List<PricePoint> all(Route route) {
        return query(route, properties.getHistory().getRetentionDays());
    }

    public Optional<PricePoint> latest(Route route) {
        return routeLocks.withLock(route, () -> {
            List<PricePoint> points = series.get(route);
            if (points == null || points.isEmpty()) {
                return Optional.<PricePoint>empty();
            }
            return Optional.of(points.get(points.size() - 1));
        });
    }

    /**
     * @return number of points removed
     */
    public int prune(Route route) {
        return routeLocks.withLock(route, () -> {
            List<PricePoint> points = series.get(route);
            return points == null ? 0 : pruneLocked(points);
        });
    }

    public Set<Route> routes() {
        return Set.copyOf(series.keySet());
    }

    private int pruneLocked(List<PricePoint> points) {
        if (points.isEmpty()) {
            return 0;
        }
        Instant cutoff = points.get(points.size() - 1).getObservedAt()
                .minus(Duration.ofDays(properties.getHistory().getRetentionDays()));
        int before = points.size();
        points.removeIf(p -> p.getObservedAt().isBefore(cutoff));
        return before - points.size();
    }
}
