package com.skypulse.engine.port;

import com.skypulse.engine.model.entity.PricePoint;
import io.vertx.core.Future;

public interface PricePointRepository {

    Future<PricePoint> save(PricePoint point);
}
