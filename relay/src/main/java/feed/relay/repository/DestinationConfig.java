package feed.relay.repository;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feed.relay.download.Subscription;
import io.vertx.core.json.JsonObject;
import org.jooq.lambda.tuple.Tuple;
import org.jooq.lambda.tuple.Tuple2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DestinationConfig {
    public String destinationId;

    public Long topicId;

    public List<String> sources = new ArrayList<>();

    /**
     * source handle -> watermark
     */
    public Map<String, Watermark> lastDelivered = new LinkedHashMap<>();

    public DestinationConfig() {
    }

    public DestinationConfig(String destinationId, Long topicId) {
        this.destinationId = destinationId;
        this.topicId = topicId;
    }

    public static DestinationConfig fromJson(JsonObject json) {
        return json.mapTo(DestinationConfig.class);
    }

    public JsonObject toJson() {
        return JsonObject.mapFrom(this);
    }

    /**
     * Add handles not subscribed yet, each starting with an empty watermark.
     *
     * @return the handles actually added
     */
    public List<String> addSources(Collection<String> handles) {
        List<String> added = new ArrayList<>();
        for (String handle : handles) {
            if (!sources.contains(handle)) {
                sources.add(handle);
                lastDelivered.put(handle, Watermark.EMPTY);
                added.add(handle);
            }
        }
        return added;
    }

    /**
     * Remove handles together with their watermarks.
     *
     * @return removed handles, handles that were not subscribed
     */
    public Tuple2<List<String>, List<String>> removeSources(Collection<String> handles) {
        List<String> removed = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String handle : handles) {
            if (sources.remove(handle)) {
                lastDelivered.remove(handle);
                removed.add(handle);
            } else {
                notFound.add(handle);
            }
        }
        return Tuple.tuple(removed, notFound);
    }

    public boolean hasSource(String handle) {
        return sources.contains(handle);
    }

    public Optional<Watermark> watermark(String handle) {
        return Optional.ofNullable(lastDelivered.get(handle)).filter(w -> !w.isEmpty());
    }

    /**
     * Move the watermark forward. A watermark with a time is never replaced by an older or equal one.
     *
     * @return true if the watermark changed
     */
    public boolean advanceWatermark(String handle, Watermark next) {
        Watermark current = lastDelivered.get(handle);
        if (current != null && current.hasTime() && next.hasTime() && next.createdAt() <= current.createdAt()) {
            return false;
        }
        lastDelivered.put(handle, next);
        return true;
    }

    @JsonIgnore
    public List<Subscription> getSubscriptions() {
        return sources.stream()
                .map(handle -> new Subscription(destinationId, topicId, handle, lastDelivered.getOrDefault(handle, Watermark.EMPTY)))
                .toList();
    }
}
