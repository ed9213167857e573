package feed.relay.repository;

import io.vertx.core.Future;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Subscription records per destination. Every read returns a fresh copy.
 */
public interface ConfigurationStore {

    Future<Void> init();

    /**
     * Completes once every write queued so far reached the file.
     */
    Future<Void> close();

    List<String> destinationIds();

    /**
     * @return the destination's config, or null if it has none
     */
    Future<DestinationConfig> get(String destinationId);

    Future<Void> save(DestinationConfig config);

    Future<Void> remove(String destinationId);

    /**
     * Atomic read-modify-write of one destination. The mapper receives a copy of the current config
     * (null if absent) and returns the config to store, or null to leave the store untouched.
     *
     * @return the stored config after the update, or null
     */
    Future<DestinationConfig> update(String destinationId, UnaryOperator<DestinationConfig> mapper);
}
