package feed.relay.delivery;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.action.ActionKind;
import feed.relay.action.ReferenceTokenRegistry;
import feed.relay.channel.ActionButton;
import feed.relay.channel.ActionKeyboard;
import feed.relay.channel.Destination;
import feed.relay.channel.NotificationChannel;
import feed.relay.core.RelayConfig;
import feed.relay.source.MediaResolver;
import feed.relay.util.ErrorHandling;
import feed.relay.util.Futures;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Sends fetched items to a destination.
 * <p>
 * A single item goes out as one message with its own action buttons. Several items are combined into
 * media groups followed by a summary message whose buttons refer to the delivered items through
 * registry tokens. Artifact files are deleted once sending is over, whatever the outcome.
 */
public class DeliveryDispatcher {

    private static final Log log = LogFactory.get();

    private final Vertx vertx;

    private final NotificationChannel channel;

    private final ReferenceTokenRegistry tokenRegistry;

    private final MediaResolver links;

    private final RetryPolicy retryPolicy;

    private final int mediaGroupLimit;

    private final long photoSetPauseMs;

    private final long networkTimeoutMs;

    public DeliveryDispatcher(Vertx vertx,
                              NotificationChannel channel,
                              ReferenceTokenRegistry tokenRegistry,
                              MediaResolver links,
                              RelayConfig config) {
        this.vertx = vertx;
        this.channel = channel;
        this.tokenRegistry = tokenRegistry;
        this.links = links;
        this.retryPolicy = config.retryPolicy();
        this.mediaGroupLimit = config.mediaGroupLimit();
        this.photoSetPauseMs = config.photoSetPauseMs();
        this.networkTimeoutMs = config.networkTimeoutMs();
    }

    /**
     * Send artifacts in media groups of at most {@code mediaGroupLimit}, in the given order.
     * The caption goes on the first group. Media groups carry no buttons, so non-empty {@code actions}
     * follow in a separate message once something was delivered. The returned future never fails.
     */
    public Future<DeliveryReport> deliver(Destination destination,
                                          List<DeliverableArtifact> artifacts,
                                          String caption,
                                          ActionKeyboard actions) {
        return sendArtifacts(destination, artifacts, caption, 0)
                .compose(report -> followUp(destination, report, StrUtil.nullToEmpty(caption), actions,
                        "Action message to " + destination.destinationId()))
                .compose(report -> cleanup(artifacts).map(report));
    }

    /**
     * Send fetched items of one source, oldest first. The returned future never fails.
     */
    public Future<DeliveryReport> deliverItems(Destination destination, String sourceHandle, List<Delivery> deliveries) {
        if (deliveries.isEmpty()) {
            return Future.succeededFuture(DeliveryReport.delivered(List.of()));
        }
        List<DeliverableArtifact> artifacts = deliveries.stream()
                .flatMap(delivery -> delivery.artifacts().stream())
                .toList();
        List<String> itemIds = deliveries.stream().map(Delivery::itemId).toList();
        Future<DeliveryReport> sent = deliveries.size() == 1
                ? deliverSingle(destination, sourceHandle, deliveries.get(0))
                : deliverGroup(destination, sourceHandle, deliveries, artifacts);
        return sent
                .recover(err -> {
                    log.error(err, "Delivery of {} item(s) from {} to {} failed", itemIds.size(), sourceHandle, destination.destinationId());
                    return Future.succeededFuture(DeliveryReport.failed(itemIds, err));
                })
                .compose(report -> cleanup(artifacts).map(report));
    }

    private Future<DeliveryReport> deliverSingle(Destination destination, String handle, Delivery delivery) {
        String itemId = delivery.itemId();
        String caption = Captions.hashtag(handle);
        if (delivery instanceof Delivery.SingleVideo video) {
            ActionKeyboard keyboard = new ActionKeyboard(List.of(
                    List.of(ActionButton.link("Watch Original Video", links.itemPageUrl(handle, itemId))),
                    List.of(ActionKind.HD.button(itemId), ActionKind.AUDIO.button(itemId), ActionKind.VIDEO_URLS.button(itemId))
            ));
            return sendSingleItem(destination, itemId,
                    () -> channel.sendSingle(destination, video.video(), caption, keyboard));
        }
        ActionKeyboard photoKeyboard = new ActionKeyboard(List.of(
                List.of(ActionKind.AUDIO.button(itemId), ActionKind.VIDEO_URLS.button(itemId))
        ));
        if (delivery instanceof Delivery.SinglePhoto photo) {
            return sendSingleItem(destination, itemId,
                    () -> channel.sendSingle(destination, photo.photo(), caption, photoKeyboard));
        }
        return sendArtifacts(destination, delivery.artifacts(), null, photoSetPauseMs)
                .compose(report -> followUp(destination, report, caption, photoKeyboard,
                        "Image set message for %s to %s".formatted(itemId, destination.destinationId())));
    }

    private Future<DeliveryReport> sendSingleItem(Destination destination, String itemId, Supplier<Future<Void>> action) {
        return send(action, "Delivery of %s to %s".formatted(itemId, destination.destinationId()))
                .map(v -> DeliveryReport.delivered(List.of(itemId)))
                .otherwise(err -> DeliveryReport.failed(List.of(itemId), err));
    }

    private Future<DeliveryReport> deliverGroup(Destination destination,
                                                String handle,
                                                List<Delivery> deliveries,
                                                List<DeliverableArtifact> artifacts) {
        return sendArtifacts(destination, artifacts, null, 0)
                .compose(report -> {
                    List<String> delivered = report.deliveredItemIds();
                    if (delivered.isEmpty()) {
                        return Future.succeededFuture(report);
                    }
                    List<Delivery> sent = deliveries.stream()
                            .filter(delivery -> delivered.contains(delivery.itemId()))
                            .toList();
                    int artifactCount = sent.stream().mapToInt(delivery -> delivery.artifacts().size()).sum();
                    boolean allPhotos = sent.stream().allMatch(Delivery::isAllPhotos);
                    String caption = allPhotos ? Captions.hashtag(handle) : Captions.total(handle, artifactCount);
                    ActionKeyboard keyboard = summaryKeyboard(handle, delivered, allPhotos);
                    return followUp(destination, report, caption, keyboard,
                            "Summary for %s to %s".formatted(handle, destination.destinationId()));
                });
    }

    /**
     * Message carrying the action buttons after media went out. Its failure does not change the report.
     */
    private Future<DeliveryReport> followUp(Destination destination,
                                            DeliveryReport report,
                                            String text,
                                            ActionKeyboard actions,
                                            String context) {
        if (report.deliveredItemIds().isEmpty() || actions == null || actions.isEmpty()) {
            return Future.succeededFuture(report);
        }
        return ErrorHandling.optional(send(() -> channel.sendMessage(destination, text, actions), context), context)
                .map(report);
    }

    private ActionKeyboard summaryKeyboard(String handle, List<String> itemIds, boolean allPhotos) {
        String audioToken = tokenRegistry.register(ActionKind.AUDIO, itemIds);
        String urlsToken = tokenRegistry.register(ActionKind.VIDEO_URLS, itemIds);
        if (allPhotos) {
            return new ActionKeyboard(List.of(
                    List.of(ActionKind.AUDIO.button(audioToken), ActionKind.VIDEO_URLS.button(urlsToken))
            ));
        }
        String hdToken = tokenRegistry.register(ActionKind.HD, itemIds);
        return new ActionKeyboard(List.of(
                List.of(ActionButton.link(ActionKind.WATCH_ORIGINAL.label(), links.profileUrl(handle))),
                List.of(ActionKind.HD.button(hdToken), ActionKind.AUDIO.button(audioToken), ActionKind.VIDEO_URLS.button(urlsToken))
        ));
    }

    private Future<DeliveryReport> sendArtifacts(Destination destination,
                                                 List<DeliverableArtifact> artifacts,
                                                 String caption,
                                                 long pauseMs) {
        List<List<DeliverableArtifact>> batches = CollUtil.split(artifacts, mediaGroupLimit);
        return sendBatches(destination, batches, 0, 0, caption, pauseMs)
                .map(progress -> toReport(artifacts, progress));
    }

    private Future<BatchProgress> sendBatches(Destination destination,
                                              List<List<DeliverableArtifact>> batches,
                                              int index,
                                              int confirmed,
                                              String caption,
                                              long pauseMs) {
        if (index >= batches.size()) {
            return Future.succeededFuture(new BatchProgress(confirmed, null));
        }
        List<DeliverableArtifact> batch = batches.get(index);
        String batchCaption = index == 0 ? caption : null;
        String context = "Batch %d/%d (%d artifact(s)) to %s".formatted(index + 1, batches.size(), batch.size(), destination.destinationId());
        Future<Void> sent = batch.size() == 1
                ? send(() -> channel.sendSingle(destination, batch.get(0), batchCaption, ActionKeyboard.NONE), context)
                : send(() -> channel.sendMediaGroup(destination, batch, batchCaption), context);
        return sent.transform(ar -> {
            if (ar.failed()) {
                log.warn("{} not delivered, {} remaining batch(es) skipped", context, batches.size() - index - 1);
                return Future.succeededFuture(new BatchProgress(confirmed, ar.cause()));
            }
            boolean last = index == batches.size() - 1;
            return Futures.delay(vertx, last ? 0 : pauseMs)
                    .compose(v -> sendBatches(destination, batches, index + 1, confirmed + batch.size(), caption, pauseMs));
        });
    }

    private Future<Void> send(Supplier<Future<Void>> action, String context) {
        return retryPolicy.execute(vertx,
                () -> Futures.withTimeout(vertx, action.get(), networkTimeoutMs, context),
                context);
    }

    private DeliveryReport toReport(List<DeliverableArtifact> artifacts, BatchProgress progress) {
        // item id -> index of its first artifact; an item with any artifact sent counts as delivered
        Map<String, Integer> firstIndex = new LinkedHashMap<>();
        for (int i = 0; i < artifacts.size(); i++) {
            firstIndex.putIfAbsent(artifacts.get(i).itemId(), i);
        }
        List<String> delivered = new ArrayList<>();
        List<String> undelivered = new ArrayList<>();
        firstIndex.forEach((itemId, index) -> {
            if (index < progress.confirmed()) {
                delivered.add(itemId);
            } else {
                undelivered.add(itemId);
            }
        });
        return new DeliveryReport(delivered, undelivered, progress.failure());
    }

    private Future<Void> cleanup(List<DeliverableArtifact> artifacts) {
        List<Future<Void>> deletions = artifacts.stream()
                .map(artifact -> ErrorHandling.silent(vertx.fileSystem().delete(artifact.path().toString())
                        .onFailure(err -> log.warn("Could not delete {}: {}", artifact.path(), err.getMessage()))))
                .toList();
        return Future.all(deletions)
                .onSuccess(r -> log.debug("Deleted {} artifact(s)", artifacts.size()))
                .mapEmpty();
    }

    private record BatchProgress(int confirmed, Throwable failure) {
    }
}
