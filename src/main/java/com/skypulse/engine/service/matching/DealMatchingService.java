package com.skypulse.engine.service.matching;

import com.skypulse.engine.exception.ValidationException;
import com.skypulse.engine.metrics.EngineMetrics;
import com.skypulse.engine.model.dto.MatchScore;
import com.skypulse.engine.model.entity.Deal;
import com.skypulse.engine.model.entity.MatchRecord;
import com.skypulse.engine.model.entity.Subscription;
import com.skypulse.engine.port.MatchRecordRepository;
import com.skypulse.engine.port.SubscriptionStore;
import com.skypulse.engine.util.EngineEvents;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * -@Service: Spring bean orchestrating deal matching.
 * --Loads candidate subscriptions, scores every pair, commits the records
 * at or above the threshold and hands them to SummaryService
 * --WithoutIT: IngestEventConsumer would have nothing to deliver deals to.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Service
@Slf4j
public class DealMatchingService {

    @Autowired
    private SubscriptionStore subscriptionStore;

    @Autowired
    private MatchScorer matchScorer;

    @Autowired
    private MatchRecordRepository matchRecordRepository;

    @Autowired
    private SummaryService summaryService;

    @Autowired
    private Vertx vertx;

    @Autowired
    private EngineMetrics metrics;

    /**
     * Match one deal against every active subscription for its route.
     *
     * FLOW:
     * 1. Validate the deal (invalid deal: WARN, empty result, no record)
     * 2. Load active subscriptions for the route
     * 3. Score each pair; a malformed subscription is skipped, not fatal
     * 4. Save one MatchRecord per score >= threshold, in PARALLEL
     * 5. After each save: publish "deal.match.created" and request the
     * summary on a separate path (never awaited here)
     *
     * -@return Future with the committed records; fails with
     * PersistenceException when the store rejects a read or a write
     */
    public Future<List<MatchRecord>> processDeal(Deal deal) {
        try {
            validate(deal);
        } catch (ValidationException e) {
            log.warn("Skipping deal {}: {}", deal == null ? null : deal.getId(), e.getMessage());
            return Future.succeededFuture(List.of());
        }

        log.info("Matching deal {} on {} at {}", deal.getId(), deal.getRoute(), deal.getPrice());

        return subscriptionStore.activeSubscriptionsForRoute(deal.getRoute())
                .compose(subscriptions -> {
                    List<Future<MatchRecord>> saves = new ArrayList<>();
                    for (Subscription subscription : subscriptions) {
                        MatchRecord record = scoreOrSkip(deal, subscription);
                        if (record != null) {
                            saves.add(matchRecordRepository.save(record)
                                    .onSuccess(saved -> afterCommit(deal, subscription, saved)));
                        }
                    }

                    log.debug("Deal {}: {} of {} subscription(s) reached the threshold",
                            deal.getId(), saves.size(), subscriptions.size());

                    return Future.all(saves)
                            .map(cf -> saves.stream()
                                    .map(Future::result)
                                    .collect(Collectors.toList()));
                })
                .onSuccess(records -> log.info("Deal {} produced {} match record(s)", deal.getId(), records.size()))
                .onFailure(error -> log.error("Failed to match deal {}", deal.getId(), error));
    }

    /**
     * Match a burst of deals. Deals are processed independently: an invalid
     * deal yields no records and the others still complete. A persistence
     * failure on any deal fails the returned Future.
     */
    public Future<List<MatchRecord>> processDeals(List<Deal> deals) {
        List<Future<List<MatchRecord>>> results = deals.stream()
                .map(this::processDeal)
                .collect(Collectors.toList());

        return Future.all(results)
                .map(cf -> results.stream()
                        .flatMap(f -> f.result().stream())
                        .collect(Collectors.toList()));
    }

    private MatchRecord scoreOrSkip(Deal deal, Subscription subscription) {
        MatchScore score;
        try {
            score = matchScorer.score(deal, subscription);
        } catch (ValidationException e) {
            log.warn("Skipping subscription {} for deal {}: {}",
                    subscription == null ? null : subscription.getId(), deal.getId(), e.getMessage());
            return null;
        }

        if (!score.isMatched()) {
            log.debug("Deal {} / subscription {} scored {} - discarded",
                    deal.getId(), subscription.getId(), score.getTotalScore());
            return null;
        }

        MatchRecord record = new MatchRecord();
        record.setId(UUID.randomUUID().toString());
        record.setDealId(deal.getId());
        record.setSubscriptionId(subscription.getId());
        record.setTotalScore(score.getTotalScore());
        record.setBreakdown(score.getBreakdown());
        record.setCreatedAt(Instant.now());
        return record;
    }

    /**
     * Runs once the record is committed. The summary outcome is backfilled;
     * a failed backfill leaves the record with a null summary.
     */
    private void afterCommit(Deal deal, Subscription subscription, MatchRecord record) {
        log.info("Match {} committed: deal {} / subscription {} scored {}",
                record.getId(), record.getDealId(), record.getSubscriptionId(), record.getTotalScore());
        metrics.matchCreated();
        publishMatchEvent(record);

        summaryService.summarize(deal, subscription, record.getBreakdown())
                .compose(summary -> {
                    record.setSummary(summary.getText());
                    record.setSummaryFromFallback(summary.isFromFallback());
                    metrics.summaryGenerated(summary.isFromFallback());
                    return matchRecordRepository.updateSummary(record.getId(), summary.getText(),
                            summary.isFromFallback());
                })
                .onSuccess(v -> log.debug("Summary backfilled for match {}", record.getId()))
                .onFailure(error -> log.error("Summary backfill failed for match {}: {}",
                        record.getId(), error.getMessage()));
    }

    private void validate(Deal deal) {
        if (deal == null) {
            throw new ValidationException("Deal is missing");
        }
        if (deal.getRoute() == null || !deal.getRoute().isComplete()) {
            throw new ValidationException("Deal " + deal.getId() + " has no complete route");
        }
        if (deal.getPrice() == null || deal.getPrice().signum() <= 0) {
            throw new ValidationException("Deal " + deal.getId() + " has no valid price");
        }
    }

    private void publishMatchEvent(MatchRecord record) {
        JsonObject event = new JsonObject()
                .put("matchId", record.getId())
                .put("dealId", record.getDealId())
                .put("subscriptionId", record.getSubscriptionId())
                .put("score", record.getTotalScore())
                .put("timestamp", record.getCreatedAt().toString());

        vertx.eventBus().publish(EngineEvents.MATCH_CREATED, event);
    }
}
