package com.skypulse.engine.port;

import com.skypulse.engine.model.dto.SummaryRequest;
import io.vertx.core.Future;

/**
 * Language-model collaborator producing the human-readable explanation of a
 * match. May fail or never complete; SummaryService bounds every call.
 */
public interface SummaryClient {

    Future<String> generate(SummaryRequest request);
}
