package feed.relay;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.action.OnDemandService;
import feed.relay.action.ReferenceTokenRegistry;
import feed.relay.core.Config;
import feed.relay.core.RelayConfig;
import feed.relay.delivery.DeliveryDispatcher;
import feed.relay.download.FetchService;
import feed.relay.download.InFlightGuard;
import feed.relay.download.MediaDownloader;
import feed.relay.download.SubscriptionPollVerticle;
import feed.relay.download.SubscriptionPoller;
import feed.relay.repository.JsonFileConfigurationStore;
import feed.relay.repository.JsonFileProcessedStore;
import feed.relay.util.ErrorHandling;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.time.Clock;

/**
 * Loads persisted state, wires the services and deploys the poll loop.
 * <p>
 * The verticle configuration is read as a {@link RelayConfig}. Once started, {@link #onDemand()} and
 * {@link #subscriptions()} are available to the embedding application's command surface.
 */
public class RelayVerticle extends AbstractVerticle {

    private static final Log log = LogFactory.get();

    private final Collaborators collaborators;

    private final Clock clock;

    private RelayConfig relayConfig;

    private ServiceContext context;

    private MediaDownloader downloader;

    private SubscriptionPoller poller;

    private OnDemandService onDemand;

    private SubscriptionsHolder subscriptions;

    private String pollDeploymentId;

    public RelayVerticle(Collaborators collaborators) {
        this(collaborators, Clock.systemUTC());
    }

    public RelayVerticle(Collaborators collaborators, Clock clock) {
        this.collaborators = collaborators.withCachedResolution();
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        relayConfig = RelayConfig.fromJson(config());
        JsonFileProcessedStore processedStore = new JsonFileProcessedStore(vertx, relayConfig.processedItemsFile());
        JsonFileConfigurationStore configurationStore = new JsonFileConfigurationStore(vertx, relayConfig.subscriptionsFile());

        ErrorHandling.critical(
                        Future.all(processedStore.init(), configurationStore.init()),
                        "Loading state from " + relayConfig.dataPath())
                .compose(r -> {
                    context = new ServiceContext(
                            processedStore,
                            configurationStore,
                            new ReferenceTokenRegistry(relayConfig.tokenSuffixLength(),
                                    relayConfig.tokenCapacity(), relayConfig.tokenTtlMs()),
                            new InFlightGuard(),
                            collaborators);
                    downloader = new MediaDownloader(vertx, relayConfig.networkTimeoutMs());
                    FetchService fetchService = new FetchService(vertx, context, downloader, relayConfig);
                    DeliveryDispatcher dispatcher = new DeliveryDispatcher(vertx, context.channel(), context.tokenRegistry(),
                            context.mediaResolver(), relayConfig);
                    poller = new SubscriptionPoller(vertx, context, fetchService, dispatcher, relayConfig, clock);
                    onDemand = new OnDemandService(vertx, context, fetchService, dispatcher, downloader, relayConfig);
                    subscriptions = new SubscriptionsHolder(configurationStore);
                    return vertx.deployVerticle(new SubscriptionPollVerticle(poller, relayConfig));
                })
                .onSuccess(deploymentId -> {
                    pollDeploymentId = deploymentId;
                    log.info("""
                            Relay verticle started!
                            |Environment: %s
                            |Data path: %s
                            |Download path: %s
                            |Destinations: %s
                            """.formatted(Config.APP_ENV,
                            relayConfig.dataPath(),
                            relayConfig.downloadPath(),
                            configurationStore.destinationIds().size()));
                    startPromise.complete();
                })
                .onFailure(startPromise::fail);
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        Future<Void> undeployed = pollDeploymentId == null || !vertx.deploymentIDs().contains(pollDeploymentId)
                ? Future.succeededFuture()
                : vertx.undeploy(pollDeploymentId);
        undeployed
                .transform(ar -> context == null
                        ? Future.<Void>succeededFuture()
                        : Future.all(context.processedStore().close(), context.configurationStore().close()).<Void>mapEmpty())
                .onComplete(ar -> {
                    if (downloader != null) {
                        downloader.close();
                    }
                    log.info("Relay verticle stopped!");
                    stopPromise.complete();
                });
    }

    public RelayConfig relayConfig() {
        return relayConfig;
    }

    public ServiceContext context() {
        return context;
    }

    public SubscriptionPoller poller() {
        return poller;
    }

    public OnDemandService onDemand() {
        return onDemand;
    }

    public SubscriptionsHolder subscriptions() {
        return subscriptions;
    }
}
