package feed.relay.download;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.date.TimeInterval;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.ServiceContext;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import feed.relay.core.RelayConfig;
import feed.relay.delivery.Delivery;
import feed.relay.delivery.DeliveryDispatcher;
import feed.relay.delivery.DeliveryReport;
import feed.relay.repository.Watermark;
import feed.relay.source.ListedItem;
import feed.relay.source.SourceRef;
import feed.relay.util.DateUtils;
import feed.relay.util.ErrorHandling;
import feed.relay.util.Futures;
import feed.relay.util.TickStatistics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.jooq.lambda.tuple.Tuple;
import org.jooq.lambda.tuple.Tuple2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Discovers, fetches and delivers new items for subscriptions.
 * <p>
 * One tick handles one subscription:
 * - LISTING: resolve the handle and list its recent items
 * - FILTERING: keep items newer than the watermark, inside the freshness window and not processed yet
 * - DOWNLOADING: reserve each candidate, then fetch it; a failed fetch releases the reservation
 * - DELIVERING: send the fetched items, oldest first
 * - COMMITTING: confirm delivered items, release the others, move the watermark forward
 * <p>
 * A tick never fails; every error ends at the item or at the subscription.
 */
public class SubscriptionPoller {

    private static final Log log = LogFactory.get();

    private final Vertx vertx;

    private final ServiceContext context;

    private final FetchService fetchService;

    private final DeliveryDispatcher dispatcher;

    private final RelayConfig config;

    private final Clock clock;

    // subscription key -> phase, only for running ticks
    private final Map<String, TickPhase> phases = new ConcurrentHashMap<>();

    public SubscriptionPoller(Vertx vertx,
                              ServiceContext context,
                              FetchService fetchService,
                              DeliveryDispatcher dispatcher,
                              RelayConfig config,
                              Clock clock) {
        this.vertx = vertx;
        this.context = context;
        this.fetchService = fetchService;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    public TickPhase phaseOf(Subscription subscription) {
        return phases.getOrDefault(subscription.key(), TickPhase.IDLE);
    }

    /**
     * Poll every subscription of every destination once, {@code pollBatchSize} subscriptions at a time
     * with a pause between batches. Stops early when {@code stopped} turns true.
     */
    public Future<TickStatistics> runPass(BooleanSupplier stopped) {
        TimeInterval timer = new TimeInterval();
        return loadSubscriptions()
                .compose(subscriptions -> {
                    if (subscriptions.isEmpty()) {
                        log.debug("No subscriptions, nothing to poll");
                        return Future.succeededFuture(TickStatistics.empty());
                    }
                    List<List<Subscription>> batches = CollUtil.split(subscriptions, config.pollBatchSize());
                    return runBatches(batches, 0, TickStatistics.empty(), stopped);
                })
                .onSuccess(stats -> log.info("Poll pass finished in {} ms: {}", timer.intervalMs(), stats.toJson().encode()));
    }

    private Future<List<Subscription>> loadSubscriptions() {
        List<String> destinationIds = context.configurationStore().destinationIds();
        List<Subscription> subscriptions = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (String destinationId : destinationIds) {
            chain = chain.compose(v -> ErrorHandling.recoverable(
                            context.configurationStore().get(destinationId),
                            null,
                            "Loading subscriptions of " + destinationId)
                    .onSuccess(destination -> {
                        if (destination != null) {
                            subscriptions.addAll(destination.getSubscriptions());
                        }
                    })
                    .mapEmpty());
        }
        return chain.map(v -> subscriptions);
    }

    private Future<TickStatistics> runBatches(List<List<Subscription>> batches,
                                              int index,
                                              TickStatistics total,
                                              BooleanSupplier stopped) {
        if (index >= batches.size()) {
            return Future.succeededFuture(total);
        }
        if (stopped.getAsBoolean()) {
            log.info("Poll pass stopped before batch {}/{}", index + 1, batches.size());
            return Future.succeededFuture(total);
        }
        List<Subscription> batch = batches.get(index);
        Future<TickStatistics> chain = Future.succeededFuture(total);
        for (Subscription subscription : batch) {
            chain = chain.compose(sum -> stopped.getAsBoolean()
                    ? Future.succeededFuture(sum)
                    : tick(subscription).map(sum::plus));
        }
        boolean last = index == batches.size() - 1;
        return chain.compose(sum -> Futures.delay(vertx, last ? 0 : config.pollBatchPauseMs())
                .compose(v -> runBatches(batches, index + 1, sum, stopped)));
    }

    /**
     * Run one tick for one subscription. The returned future never fails.
     */
    public Future<TickStatistics> tick(Subscription subscription) {
        String key = subscription.key();
        phase(subscription, TickPhase.LISTING);
        return listing(subscription)
                .compose(listed -> {
                    SourceRef source = listed.v1;
                    List<ListedItem> items = listed.v2;
                    if (items.isEmpty()) {
                        log.debug("[{}] Listing is empty", key);
                        return Future.succeededFuture(TickStatistics.listedOnly(0));
                    }
                    phase(subscription, TickPhase.FILTERING);
                    List<Candidate> candidates = selectCandidates(subscription, items, DateUtils.currentSourceSeconds(clock));
                    if (candidates.isEmpty()) {
                        log.debug("[{}] No new items among {} listed", key, items.size());
                        return Future.succeededFuture(TickStatistics.listedOnly(items.size()));
                    }
                    log.info("[{}] {} new item(s): {}", key, candidates.size(),
                            candidates.stream().map(Candidate::itemId).toList());
                    return process(subscription, source, candidates)
                            .map(stats -> new TickStatistics(1, items.size(), candidates.size(), stats.fetched(), stats.delivered()));
                })
                .recover(err -> {
                    log.warn("[{}] Tick ended: {}", key, err.getMessage());
                    return Future.succeededFuture(TickStatistics.listedOnly(0));
                })
                .onComplete(ar -> phases.remove(key));
    }

    private Future<Tuple2<SourceRef, List<ListedItem>>> listing(Subscription subscription) {
        String handle = subscription.handle();
        long timeout = config.networkTimeoutMs();
        return Futures.withTimeout(vertx, context.sourceDirectory().resolve(handle), timeout, "Resolve " + handle)
                .recover(err -> Future.failedFuture(
                        FetchException.wrap(err, FetchFailure.USER_RESOLUTION_FAILED, "Resolve " + handle)))
                .compose(source -> Futures.withTimeout(vertx, context.listingProvider().listRecentItems(source), timeout, "List " + handle)
                        .recover(err -> Future.failedFuture(
                                FetchException.wrap(err, FetchFailure.NO_VIDEO_LISTING, "List " + handle)))
                        .map(items -> Tuple.tuple(source, items == null ? List.<ListedItem>of() : items)));
    }

    /**
     * Items strictly newer than the watermark, created at most {@code freshnessWindowSeconds} before
     * {@code nowSeconds} and not yet processed for the destination, oldest first.
     * Items with a malformed creation time are skipped.
     */
    List<Candidate> selectCandidates(Subscription subscription, List<ListedItem> items, long nowSeconds) {
        long watermarkTime = watermarkTime(subscription.watermark(), items);
        Set<String> seen = new HashSet<>();
        List<Candidate> candidates = new ArrayList<>();
        for (ListedItem item : items) {
            Optional<Long> createdAt = DateUtils.parseSourceSeconds(item.createTime());
            if (createdAt.isEmpty()) {
                log.debug("[{}] Item {} has malformed creation time '{}', skipped", subscription.key(), item.itemId(), item.createTime());
                continue;
            }
            long created = createdAt.get();
            if (DateUtils.isAfterWatermark(created, watermarkTime)
                    && DateUtils.isWithinFreshnessWindow(created, nowSeconds, config.freshnessWindowSeconds())
                    && context.processedStore().isNew(subscription.destinationId(), item.itemId())
                    && seen.add(item.itemId())) {
                candidates.add(new Candidate(item.itemId(), created));
            }
        }
        candidates.sort(Comparator.comparingLong(Candidate::createdAt));
        return candidates;
    }

    /**
     * Stored watermark time, else the listed creation time of the watermark item, else 0.
     */
    static long watermarkTime(Watermark watermark, List<ListedItem> items) {
        if (watermark == null || watermark.isEmpty()) {
            return 0;
        }
        if (watermark.hasTime()) {
            return watermark.createdAt();
        }
        return items.stream()
                .filter(item -> watermark.itemId().equals(item.itemId()))
                .findFirst()
                .flatMap(item -> DateUtils.parseSourceSeconds(item.createTime()))
                .orElse(0L);
    }

    private Future<TickStatistics> process(Subscription subscription, SourceRef source, List<Candidate> candidates) {
        phase(subscription, TickPhase.DOWNLOADING);
        return download(subscription, source, candidates)
                .compose(fetched -> {
                    if (fetched.isEmpty()) {
                        log.info("[{}] Nothing could be fetched", subscription.key());
                        return Future.succeededFuture(new TickStatistics(1, 0, 0, 0, 0));
                    }
                    phase(subscription, TickPhase.DELIVERING);
                    List<Delivery> deliveries = fetched.stream().map(Tuple2::v2).toList();
                    return dispatcher.deliverItems(subscription.destination(), subscription.handle(), deliveries)
                            .compose(report -> {
                                phase(subscription, TickPhase.COMMITTING);
                                List<Candidate> fetchedCandidates = fetched.stream().map(Tuple2::v1).toList();
                                return commit(subscription, fetchedCandidates, report)
                                        .map(v -> new TickStatistics(1, 0, 0, fetched.size(), report.deliveredItemIds().size()));
                            });
                });
    }

    private Future<List<Tuple2<Candidate, Delivery>>> download(Subscription subscription,
                                                               SourceRef source,
                                                               List<Candidate> candidates) {
        String destinationId = subscription.destinationId();
        List<Tuple2<Candidate, Delivery>> fetched = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (Candidate candidate : candidates) {
            String itemId = candidate.itemId();
            chain = chain.compose(v -> ErrorHandling.critical(
                            context.processedStore().reserve(destinationId, itemId),
                            "Reserving %s for %s".formatted(itemId, destinationId))
                    .compose(won -> {
                        if (!won) {
                            log.debug("[{}] {} already reserved", subscription.key(), itemId);
                            return Future.<Void>succeededFuture();
                        }
                        return fetchService.fetch(source, itemId)
                                .onSuccess(delivery -> fetched.add(Tuple.tuple(candidate, delivery)))
                                .<Void>mapEmpty()
                                .recover(err -> {
                                    log.warn("[{}] Fetch of {} failed: {}", subscription.key(), itemId, err.getMessage());
                                    return context.processedStore().release(destinationId, itemId);
                                });
                    })
                    .recover(err -> Future.succeededFuture()));
        }
        return chain.map(v -> fetched);
    }

    private Future<Void> commit(Subscription subscription, List<Candidate> fetched, DeliveryReport report) {
        String destinationId = subscription.destinationId();
        List<String> delivered = report.deliveredItemIds();
        if (!report.isComplete()) {
            log.warn("[{}] Delivery incomplete: {}", subscription.key(), report.toJson().encode());
        }
        Future<Void> released = Future.succeededFuture();
        for (String itemId : report.undeliveredItemIds()) {
            released = released.compose(v -> ErrorHandling.critical(
                    context.processedStore().release(destinationId, itemId),
                    "Releasing %s for %s".formatted(itemId, destinationId)));
        }
        Optional<Candidate> newest = fetched.stream()
                .filter(candidate -> delivered.contains(candidate.itemId()))
                .max(Comparator.comparingLong(Candidate::createdAt));
        return released
                .compose(v -> context.processedStore().confirm(destinationId, delivered))
                .compose(v -> newest.map(candidate -> advanceWatermark(subscription, candidate)).orElse(Future.succeededFuture()))
                .recover(err -> {
                    log.error("[{}] Commit failed: {}", subscription.key(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> advanceWatermark(Subscription subscription, Candidate candidate) {
        String handle = subscription.handle();
        return context.configurationStore().update(subscription.destinationId(), current -> {
                    if (current == null || !current.hasSource(handle)) {
                        log.info("[{}] Unsubscribed during tick, watermark not stored", subscription.key());
                        return null;
                    }
                    return current.advanceWatermark(handle, candidate.toWatermark()) ? current : null;
                })
                .onSuccess(updated -> log.debug("[{}] Watermark {}", subscription.key(),
                        Optional.ofNullable(updated).flatMap(c -> c.watermark(handle)).map(Watermark::itemId).orElse("-")))
                .mapEmpty();
    }

    private void phase(Subscription subscription, TickPhase phase) {
        phases.put(subscription.key(), phase);
        log.trace("[{}] {}", subscription.key(), phase);
    }
}
