package feed.relay.repository;

import io.vertx.core.Future;

import java.util.Collection;
import java.util.Set;

/**
 * Per-destination set of item ids that were delivered or are being delivered.
 * An id in the set is never downloaded or delivered to that destination again.
 */
public interface ProcessedStore {

    Future<Void> init();

    /**
     * Completes once every write queued so far reached the file.
     */
    Future<Void> close();

    boolean isNew(String destinationId, String itemId);

    /**
     * Add the id before its download starts.
     *
     * @return true if this caller added it, false if it was already present
     */
    Future<Boolean> reserve(String destinationId, String itemId);

    /**
     * Undo a reservation made by this process that was not confirmed yet. No-op otherwise.
     */
    Future<Void> release(String destinationId, String itemId);

    /**
     * Mark reserved ids as delivered; they can no longer be released.
     */
    Future<Void> confirm(String destinationId, Collection<String> itemIds);

    Set<String> processed(String destinationId);
}
