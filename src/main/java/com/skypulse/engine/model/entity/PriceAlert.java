package com.skypulse.engine.model.entity;

import com.skypulse.engine.model.Route;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's target-price watch on a route.
 *
 * State only changes through {@link #tryTrigger} and {@link #rearm}, so a
 * TRIGGERED alert cannot fire again and triggeredAt/triggeredPrice are set if
 * and only if the alert is TRIGGERED.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class PriceAlert {

    private final String id;
    private final Route route;
    private final String userRef;
    private final BigDecimal targetPrice;
    private final Instant createdAt;

    private AlertState state = AlertState.ARMED;
    private Instant triggeredAt;
    private BigDecimal triggeredPrice;

    public PriceAlert(String id, Route route, String userRef, BigDecimal targetPrice, Instant createdAt) {
        this.id = id;
        this.route = route;
        this.userRef = userRef;
        this.targetPrice = targetPrice;
        this.createdAt = createdAt;
    }

    private PriceAlert(PriceAlert source) {
        this(source.id, source.route, source.userRef, source.targetPrice, source.createdAt);
        this.state = source.state;
        this.triggeredAt = source.triggeredAt;
        this.triggeredPrice = source.triggeredPrice;
    }

    /**
     * Detached copy of the current state. Later transitions on this alert do
     * not show in the copy.
     */
    public PriceAlert snapshot() {
        return new PriceAlert(this);
    }

    public boolean isArmed() {
        return state == AlertState.ARMED;
    }

    /**
     * ARMED -> TRIGGERED when price <= targetPrice.
     *
     * @return true only for the observation that performed the transition
     */
    public boolean tryTrigger(BigDecimal price, Instant observedAt) {
        if (state == AlertState.TRIGGERED || price.compareTo(targetPrice) > 0) {
            return false;
        }
        state = AlertState.TRIGGERED;
        triggeredAt = observedAt;
        triggeredPrice = price;
        return true;
    }

    /**
     * TRIGGERED -> ARMED. Re-arming an armed alert changes nothing.
     *
     * @return true if the alert was triggered before the call
     */
    public boolean rearm() {
        if (state == AlertState.ARMED) {
            return false;
        }
        state = AlertState.ARMED;
        triggeredAt = null;
        triggeredPrice = null;
        return true;
    }
}
