package com.skypulse.engine.model.entity;

/**
 * Lifecycle of a PriceAlert.
 *
 * ARMED -> TRIGGERED on the first price at or under the target;
 * TRIGGERED -> ARMED only through an explicit rearm.
 */
public enum AlertState {
    ARMED,
    TRIGGERED
}
