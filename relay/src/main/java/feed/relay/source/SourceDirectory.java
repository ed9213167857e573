package feed.relay.source;

import io.vertx.core.Future;

public interface SourceDirectory {

    /**
     * Resolve a public handle. The future fails when the handle is unknown.
     */
    Future<SourceRef> resolve(String handle);
}
