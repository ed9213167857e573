package feed.relay.source;

import io.vertx.core.Future;

public interface MediaResolver {

    Future<MediaDescriptor> resolveMedia(String itemId);

    /**
     * Direct URL of a variant; fails when the item has no such rendition.
     */
    Future<String> resolveVariant(String itemId, MediaVariant variant);

    String itemPageUrl(String handle, String itemId);

    String profileUrl(String handle);
}
