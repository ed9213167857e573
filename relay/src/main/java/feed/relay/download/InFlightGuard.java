package feed.relay.download;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import io.vertx.core.Future;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide set of item ids currently being downloaded, whatever the destination.
 */
public class InFlightGuard {

    private static final Log log = LogFactory.get();

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String itemId) {
        return inFlight.add(itemId);
    }

    public void release(String itemId) {
        inFlight.remove(itemId);
    }

    public boolean isInFlight(String itemId) {
        return inFlight.contains(itemId);
    }

    public int size() {
        return inFlight.size();
    }

    /**
     * Run the action while holding the item. The item is released when the action completes, in every case.
     * A caller that cannot acquire the item gets {@link FetchFailure#ALREADY_IN_FLIGHT}.
     */
    public <T> Future<T> guard(String itemId, Supplier<Future<T>> action) {
        if (!tryAcquire(itemId)) {
            log.debug("Item {} is already in flight, skipped", itemId);
            return Future.failedFuture(new FetchException(FetchFailure.ALREADY_IN_FLIGHT, itemId));
        }
        Future<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            release(itemId);
            return Future.failedFuture(e);
        }
        return future.onComplete(ar -> release(itemId));
    }
}
