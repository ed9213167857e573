package feed.relay.action;

import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.ServiceContext;
import feed.relay.channel.ActionKeyboard;
import feed.relay.channel.Destination;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import feed.relay.core.RelayConfig;
import feed.relay.delivery.Captions;
import feed.relay.delivery.Delivery;
import feed.relay.delivery.DeliveryDispatcher;
import feed.relay.delivery.RetryPolicy;
import feed.relay.download.FetchService;
import feed.relay.download.MediaDownloader;
import feed.relay.source.MediaVariant;
import feed.relay.util.ErrorHandling;
import feed.relay.util.Futures;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Requests made by a user rather than by the scheduler: fetching one item by hand, and the follow-up
 * actions behind delivered messages.
 */
public class OnDemandService {

    private static final Log log = LogFactory.get();

    private final Vertx vertx;

    private final ServiceContext context;

    private final FetchService fetchService;

    private final DeliveryDispatcher dispatcher;

    private final MediaDownloader downloader;

    private final RetryPolicy retryPolicy;

    private final Path variantDirectory;

    private final long networkTimeoutMs;

    public OnDemandService(Vertx vertx,
                           ServiceContext context,
                           FetchService fetchService,
                           DeliveryDispatcher dispatcher,
                           MediaDownloader downloader,
                           RelayConfig config) {
        this.vertx = vertx;
        this.context = context;
        this.fetchService = fetchService;
        this.dispatcher = dispatcher;
        this.downloader = downloader;
        this.retryPolicy = config.retryPolicy();
        this.variantDirectory = Path.of(config.downloadPath(), "variants");
        this.networkTimeoutMs = config.networkTimeoutMs();
    }

    /**
     * Fetch one item of a source and deliver it as a single item, under the same reservation and
     * in-flight rules as the scheduler.
     */
    public Future<ActionOutcome> fetchAndDeliver(String handle, String itemId, Destination destination) {
        String destinationId = destination.destinationId();
        return Futures.withTimeout(vertx, context.sourceDirectory().resolve(handle), networkTimeoutMs, "Resolve " + handle)
                .recover(err -> Future.failedFuture(FetchException.wrap(err, FetchFailure.USER_RESOLUTION_FAILED, "Resolve " + handle)))
                .compose(source -> ErrorHandling.critical(
                                context.processedStore().reserve(destinationId, itemId),
                                "Reserving %s for %s".formatted(itemId, destinationId))
                        .compose(won -> {
                            if (!won) {
                                return Future.succeededFuture(ActionOutcome.failed(ActionOutcome.ALREADY_DELIVERED));
                            }
                            return fetchService.fetch(source, itemId)
                                    .recover(err -> context.processedStore().release(destinationId, itemId)
                                            .transform(ar -> Future.<Delivery>failedFuture(err)))
                                    .compose(delivery -> dispatcher.deliverItems(destination, handle, List.of(delivery)))
                                    .compose(report -> {
                                        if (report.deliveredItemIds().contains(itemId)) {
                                            return context.processedStore().confirm(destinationId, report.deliveredItemIds())
                                                    .map(ActionOutcome.ok(ActionOutcome.DELIVERED));
                                        }
                                        return context.processedStore().release(destinationId, itemId)
                                                .map(ActionOutcome.failed(FetchFailure.NETWORK_FAILURE.userMessage()));
                                    });
                        }))
                .recover(err -> {
                    log.warn("Manual fetch of {} from {} for {} failed: {}", itemId, handle, destinationId, err.getMessage());
                    return Future.succeededFuture(ActionOutcome.failed(userMessage(err)));
                });
    }

    /**
     * Handle a pressed action button.
     *
     * @param callbackData  wire form of the button, {@code <prefix>|<token>}
     * @param requester     where results are sent
     * @param messageText   caption or text of the message carrying the button, used to find the source handle
     */
    public Future<ActionOutcome> handleCallback(String callbackData, Destination requester, String messageText) {
        return CallbackData.parse(callbackData)
                .map(parsed -> handleAction(parsed.v1, parsed.v2, requester, Captions.handleOf(messageText)))
                .orElseGet(() -> {
                    log.debug("Unknown callback data: {}", callbackData);
                    return Future.succeededFuture(ActionOutcome.failed(ActionOutcome.UNSUPPORTED));
                });
    }

    /**
     * HD and AUDIO consume a registry token, VIDEO_URLS only reads it. A token that is not shaped like a
     * registry token is the item id itself.
     */
    public Future<ActionOutcome> handleAction(ActionKind kind, String token, Destination requester, String sourceHandle) {
        if (!kind.isCallback()) {
            return Future.succeededFuture(ActionOutcome.failed(ActionOutcome.UNSUPPORTED));
        }
        Optional<List<String>> itemIds = itemIdsOf(kind, token);
        if (itemIds.isEmpty()) {
            log.debug("Token {} for {} has expired", token, kind);
            return Future.succeededFuture(ActionOutcome.failed(ActionOutcome.EXPIRED));
        }
        List<String> ids = itemIds.get();
        return switch (kind) {
            case HD -> sendVariants(MediaVariant.HD, ids, requester, sourceHandle);
            case AUDIO -> sendVariants(MediaVariant.AUDIO, ids, requester, sourceHandle);
            case VIDEO_URLS -> sendItemUrls(ids, requester, sourceHandle);
            case WATCH_ORIGINAL -> Future.succeededFuture(ActionOutcome.failed(ActionOutcome.UNSUPPORTED));
        };
    }

    private Optional<List<String>> itemIdsOf(ActionKind kind, String token) {
        if (!context.tokenRegistry().isRegistryToken(token)) {
            return Optional.of(List.of(token));
        }
        return kind.isSingleUse()
                ? context.tokenRegistry().consumeOnce(token)
                : context.tokenRegistry().resolve(token);
    }

    private Future<ActionOutcome> sendVariants(MediaVariant variant, List<String> itemIds, Destination requester, String sourceHandle) {
        AtomicInteger sent = new AtomicInteger();
        Future<Void> chain = Future.succeededFuture();
        for (String itemId : itemIds) {
            chain = chain.compose(v -> sendVariant(variant, itemId, requester, sourceHandle)
                    .onSuccess(r -> sent.incrementAndGet())
                    .recover(err -> {
                        log.warn("{} of {} for {} failed: {}", variant, itemId, requester.destinationId(), err.getMessage());
                        return Future.succeededFuture();
                    }));
        }
        return chain.map(v -> sent.get() == 0
                ? ActionOutcome.failed(FetchFailure.NO_DOWNLOADABLE_MEDIA.userMessage())
                : ActionOutcome.ok("Sent %d of %d file(s)".formatted(sent.get(), itemIds.size())));
    }

    private Future<Void> sendVariant(MediaVariant variant, String itemId, Destination requester, String sourceHandle) {
        Path file = variantDirectory.resolve("%s_%s_%s%s".formatted(
                variant.filePrefix(), itemId, RandomUtil.randomString(8), variant.extension()));
        String caption = StrUtil.isBlank(sourceHandle) ? null : Captions.hashtag(sourceHandle);
        String description = "%s of %s to %s".formatted(variant, itemId, requester.destinationId());
        return Futures.withTimeout(vertx, context.mediaResolver().resolveVariant(itemId, variant), networkTimeoutMs, description)
                .recover(err -> Future.failedFuture(FetchException.wrap(err, FetchFailure.NO_DOWNLOADABLE_MEDIA, description)))
                .compose(url -> downloader.download(url, file))
                .compose(path -> retryPolicy.execute(vertx,
                        () -> Futures.withTimeout(vertx, context.channel().sendDocument(requester, path, caption), networkTimeoutMs, description),
                        description))
                .transform(ar -> ErrorHandling.silent(vertx.fileSystem().delete(file.toString())
                                .onFailure(err -> log.warn("Could not delete {}: {}", file, err.getMessage())))
                        .transform(ignore -> ar.succeeded() ? Future.<Void>succeededFuture() : Future.<Void>failedFuture(ar.cause())));
    }

    private Future<ActionOutcome> sendItemUrls(List<String> itemIds, Destination requester, String sourceHandle) {
        if (StrUtil.isBlank(sourceHandle)) {
            return Future.succeededFuture(ActionOutcome.failed(FetchFailure.USER_RESOLUTION_FAILED.userMessage()));
        }
        AtomicInteger sent = new AtomicInteger();
        Future<Void> chain = Future.succeededFuture();
        for (String itemId : itemIds) {
            String url = context.mediaResolver().itemPageUrl(sourceHandle, itemId);
            String description = "URL of %s to %s".formatted(itemId, requester.destinationId());
            chain = chain.compose(v -> retryPolicy.execute(vertx,
                            () -> Futures.withTimeout(vertx, context.channel().sendMessage(requester, url, ActionKeyboard.NONE), networkTimeoutMs, description),
                            description)
                    .onSuccess(r -> sent.incrementAndGet())
                    .recover(err -> Future.succeededFuture()));
        }
        return chain.map(v -> sent.get() == itemIds.size()
                ? ActionOutcome.ok("Sent %d URL(s)".formatted(sent.get()))
                : ActionOutcome.failed("Sent %d of %d URL(s)".formatted(sent.get(), itemIds.size())));
    }

    private static String userMessage(Throwable err) {
        if (err instanceof FetchException fe) {
            return fe.getFailure().userMessage();
        }
        return FetchFailure.NETWORK_FAILURE.userMessage();
    }
}
