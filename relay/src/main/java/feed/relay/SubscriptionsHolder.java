package feed.relay;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.repository.ConfigurationStore;
import feed.relay.repository.DestinationConfig;
import io.vertx.core.Future;
import org.jooq.lambda.tuple.Tuple;
import org.jooq.lambda.tuple.Tuple2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Subscribe and unsubscribe sources for a destination. Changes are picked up by the next tick.
 */
public class SubscriptionsHolder {
    private final Log log = LogFactory.get();

    private final ConfigurationStore configurationStore;

    public SubscriptionsHolder(ConfigurationStore configurationStore) {
        this.configurationStore = configurationStore;
    }

    /**
     * Merge handles into the destination's sources; new handles start with an empty watermark.
     *
     * @return handles that were not subscribed before
     */
    public Future<List<String>> subscribe(String destinationId, Long topicId, Collection<String> handles) {
        List<String> normalized = normalize(handles);
        if (normalized.isEmpty()) {
            return Future.succeededFuture(List.of());
        }
        List<String> added = new ArrayList<>();
        return configurationStore.update(destinationId, current -> {
                    DestinationConfig config = current == null ? new DestinationConfig(destinationId, topicId) : current;
                    if (topicId != null) {
                        config.topicId = topicId;
                    }
                    added.addAll(config.addSources(normalized));
                    return config;
                })
                .onSuccess(config -> log.info("Subscribed %s to %s, %d source(s) in total".formatted(destinationId, added, config.sources.size())))
                .onFailure(e -> log.error("Subscribe %s failed: %s".formatted(destinationId, e.getMessage())))
                .map(config -> List.copyOf(added));
    }

    /**
     * Remove handles and their watermarks.
     *
     * @return removed handles, handles that were not subscribed
     */
    public Future<Tuple2<List<String>, List<String>>> unsubscribe(String destinationId, Collection<String> handles) {
        List<String> normalized = normalize(handles);
        List<String> removed = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        return configurationStore.update(destinationId, current -> {
                    if (current == null) {
                        notFound.addAll(normalized);
                        return null;
                    }
                    Tuple2<List<String>, List<String>> result = current.removeSources(normalized);
                    removed.addAll(result.v1);
                    notFound.addAll(result.v2);
                    return CollUtil.isEmpty(removed) ? null : current;
                })
                .onSuccess(config -> {
                    if (CollUtil.isNotEmpty(removed)) {
                        log.info("Unsubscribed %s from %s".formatted(destinationId, removed));
                    }
                })
                .map(config -> Tuple.tuple(List.copyOf(removed), List.copyOf(notFound)));
    }

    public Future<List<String>> subscriptions(String destinationId) {
        return configurationStore.get(destinationId)
                .map(config -> config == null ? List.<String>of() : List.copyOf(config.sources));
    }

    private static List<String> normalize(Collection<String> handles) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String handle : handles) {
            String trimmed = StrUtil.removePrefix(StrUtil.trim(handle), "@");
            if (StrUtil.isNotBlank(trimmed)) {
                normalized.add(trimmed);
            }
        }
        return new ArrayList<>(normalized);
    }
}
