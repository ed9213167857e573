package feed.relay;

import feed.relay.channel.NotificationChannel;
import feed.relay.source.CachingSourceDirectory;
import feed.relay.source.ListingProvider;
import feed.relay.source.MediaResolver;
import feed.relay.source.SourceDirectory;

/**
 * Implementations of the provider and transport side, supplied by the embedding application.
 */
public record Collaborators(
        SourceDirectory sourceDirectory,
        ListingProvider listingProvider,
        MediaResolver mediaResolver,
        NotificationChannel channel
) {

    /**
     * Same collaborators with handle resolution cached for the lifetime of the process.
     */
    public Collaborators withCachedResolution() {
        if (sourceDirectory instanceof CachingSourceDirectory) {
            return this;
        }
        return new Collaborators(new CachingSourceDirectory(sourceDirectory), listingProvider, mediaResolver, channel);
    }
}
