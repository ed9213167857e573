package feed.relay.source;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import io.vertx.core.Future;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps resolved handles for the lifetime of the process. Failed lookups are not cached.
 */
public class CachingSourceDirectory implements SourceDirectory {

    private static final Log log = LogFactory.get();

    private final SourceDirectory delegate;

    private final Map<String, SourceRef> resolved = new ConcurrentHashMap<>();

    public CachingSourceDirectory(SourceDirectory delegate) {
        this.delegate = delegate;
    }

    @Override
    public Future<SourceRef> resolve(String handle) {
        SourceRef cached = resolved.get(handle);
        if (cached != null) {
            return Future.succeededFuture(cached);
        }
        return delegate.resolve(handle)
                .onSuccess(ref -> {
                    resolved.put(handle, ref);
                    log.debug("Resolved source {} -> {}", handle, ref.internalId());
                });
    }
}
