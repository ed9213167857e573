package feed.relay.source;

import io.vertx.core.Future;

import java.util.List;

public interface ListingProvider {

    /**
     * The most recent items of a source, in the order the provider returns them.
     */
    Future<List<ListedItem>> listRecentItems(SourceRef source);
}
