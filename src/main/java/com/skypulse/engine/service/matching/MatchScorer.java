package com.skypulse.engine.service.matching;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.model.dto.MatchScore;
import com.skypulse.engine.model.dto.ScoreBreakdown;
import com.skypulse.engine.model.entity.Deal;
import com.skypulse.engine.model.entity.Subscription;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Scores how well a deal satisfies a subscription.
 *
 * SCORE COMPONENTS (weights from skypulse.engine.match, 40/30/20/10 by default):
 * - Destination: full weight when unset or matching the deal's arrival city
 * - Price: full weight when unset or price <= maxPrice, else 0 (binary: the
 * cap already encodes affordability)
 * - Date: weight x fraction of the deal's travel days inside the
 * subscription window; full weight when no window is set
 * - Origin: same rule as destination against the departure city
 *
 * totalScore = floor(sum of sub-scores), clamped to 0..100, so a record is
 * created exactly when the weighted sum reaches the threshold.
 *
 * Pure and stateless: no locking, safe to call from any thread.
 *
 * =========
 * -@Service: Spring bean holding the scoring rules.
 * --WithoutIT: DealMatchingService could not be wired.
 */
@Service
public class MatchScorer {

    // Absorbs binary rounding of fractional date scores (e.g. 49.99999999)
    private static final double EPSILON = 1e-9;

    @Autowired
    private EngineProperties properties;

    @Autowired
    private LocationMatcher locationMatcher;

    /**
     * @throws ValidationException when the deal lacks route or price, or
     *                             either input is malformed; no score is
     *                             produced
     */
    public MatchScore score(Deal deal, Subscription subscription) {
        validateDeal(deal);
        validateSubscription(subscription);

        EngineProperties.Match weights = properties.getMatch();

        double destination = locationScore(deal.getRoute().getDestination(), subscription.getDestination(),
                weights.getDestinationWeight());
        double origin = locationScore(deal.getRoute().getOrigin(), subscription.getOrigin(),
                weights.getOriginWeight());
        double price = priceScore(deal.getPrice(), subscription.getMaxPrice(), weights.getPriceWeight());
        double date = dateScore(deal, subscription, weights.getDateWeight());

        ScoreBreakdown breakdown = new ScoreBreakdown(destination, price, date, origin);
        int total = (int) Math.floor(breakdown.sum() + EPSILON);
        total = Math.max(0, Math.min(100, total));

        return new MatchScore(total, breakdown, total >= weights.getThreshold());
    }

    private double locationScore(String dealCity, String wanted, int weight) {
        if (wanted == null || wanted.trim().isEmpty()) {
            return weight;
        }
        return locationMatcher.matches(dealCity, wanted) ? weight : 0.0;
    }

    private double priceScore(BigDecimal price, BigDecimal maxPrice, int weight) {
        if (maxPrice == null) {
            return weight;
        }
        return price.compareTo(maxPrice) <= 0 ? weight : 0.0;
    }

    private double dateScore(Deal deal, Subscription subscription, int weight) {
        if (!subscription.hasDateWindow()) {
            return weight;
        }
        if (deal.getDepartureDate() == null) {
            // Unknown travel dates against a dated subscription: neutral half credit
            return weight / 2.0;
        }
        LocalDate travelStart = deal.getDepartureDate();
        LocalDate travelEnd = deal.getReturnDate() != null ? deal.getReturnDate() : travelStart;
        long travelDays = ChronoUnit.DAYS.between(travelStart, travelEnd) + 1;

        LocalDate overlapStart = subscription.getStartDate() == null || travelStart.isAfter(subscription.getStartDate())
                ? travelStart
                : subscription.getStartDate();
        LocalDate overlapEnd = subscription.getEndDate() == null || travelEnd.isBefore(subscription.getEndDate())
                ? travelEnd
                : subscription.getEndDate();

        if (overlapEnd.isBefore(overlapStart)) {
            return 0.0;
        }
        long overlapDays = ChronoUnit.DAYS.between(overlapStart, overlapEnd) + 1;
        double fraction = (double) overlapDays / travelDays;
        return Math.max(0.0, Math.min(weight, weight * fraction));
    }

    private void validateDeal(Deal deal) {
        if (deal == null) {
            throw new ValidationException("Deal is missing");
        }
        if (deal.getRoute() == null || !deal.getRoute().isComplete()) {
            throw new ValidationException("Deal " + deal.getId() + " has no complete route");
        }
        if (deal.getPrice() == null) {
            throw new ValidationException("Deal " + deal.getId() + " has no price");
        }
        if (deal.getPrice().signum() <= 0) {
            throw new ValidationException("Deal " + deal.getId() + " has a non-positive price: " + deal.getPrice());
        }
        if (deal.getDepartureDate() != null && deal.getReturnDate() != null
                && deal.getReturnDate().isBefore(deal.getDepartureDate())) {
            throw new ValidationException("Deal " + deal.getId() + " returns before it departs");
        }
    }

    private void validateSubscription(Subscription subscription) {
        if (subscription == null) {
            throw new ValidationException("Subscription is missing");
        }
        if (subscription.getMaxPrice() != null && subscription.getMaxPrice().signum() <= 0) {
            throw new ValidationException("Subscription " + subscription.getId()
                    + " has a non-positive maxPrice: " + subscription.getMaxPrice());
        }
        if (subscription.getStartDate() != null && subscription.getEndDate() != null
                && subscription.getEndDate().isBefore(subscription.getStartDate())) {
            throw new ValidationException("Subscription " + subscription.getId() + " has an inverted date window");
        }
    }
}
