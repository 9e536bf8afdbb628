package com.skypulse.engine.port;

import com.skypulse.engine.model.entity.PriceAlert;
import io.vertx.core.Future;

/**
 * Writes the current state of an alert (upsert by id).
 */
public interface PriceAlertRepository {

    Future<PriceAlert> save(PriceAlert alert);
}
