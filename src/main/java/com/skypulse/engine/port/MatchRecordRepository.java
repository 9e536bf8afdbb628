package com.skypulse.engine.port;

import com.skypulse.engine.model.entity.MatchRecord;
import io.vertx.core.Future;

/**
 * Persistence collaborator for match records. Failures surface as
 * {@link com.skypulse.engine.exception.PersistenceException}.
 */
public interface MatchRecordRepository {

    Future<MatchRecord> save(MatchRecord record);

    Future<Void> updateSummary(String recordId, String summary, boolean fromFallback);
}
