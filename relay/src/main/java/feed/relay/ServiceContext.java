package feed.relay;

import feed.relay.action.ReferenceTokenRegistry;
import feed.relay.channel.NotificationChannel;
import feed.relay.download.InFlightGuard;
import feed.relay.repository.ConfigurationStore;
import feed.relay.repository.ProcessedStore;
import feed.relay.source.ListingProvider;
import feed.relay.source.MediaResolver;
import feed.relay.source.SourceDirectory;

/**
 * Context object that holds references to stores, registries and external collaborators for dependency injection.
 * This allows services to be testable by injecting in-memory or mocked implementations.
 */
public class ServiceContext {

    private final ProcessedStore processedStore;
    private final ConfigurationStore configurationStore;
    private final ReferenceTokenRegistry tokenRegistry;
    private final InFlightGuard inFlightGuard;
    private final Collaborators collaborators;

    public ServiceContext(
            ProcessedStore processedStore,
            ConfigurationStore configurationStore,
            ReferenceTokenRegistry tokenRegistry,
            InFlightGuard inFlightGuard,
            Collaborators collaborators
    ) {
        this.processedStore = processedStore;
        this.configurationStore = configurationStore;
        this.tokenRegistry = tokenRegistry;
        this.inFlightGuard = inFlightGuard;
        this.collaborators = collaborators;
    }

    public ProcessedStore processedStore() {
        return processedStore;
    }

    public ConfigurationStore configurationStore() {
        return configurationStore;
    }

    public ReferenceTokenRegistry tokenRegistry() {
        return tokenRegistry;
    }

    public InFlightGuard inFlightGuard() {
        return inFlightGuard;
    }

    public SourceDirectory sourceDirectory() {
        return collaborators.sourceDirectory();
    }

    public ListingProvider listingProvider() {
        return collaborators.listingProvider();
    }

    public MediaResolver mediaResolver() {
        return collaborators.mediaResolver();
    }

    public NotificationChannel channel() {
        return collaborators.channel();
    }
}
