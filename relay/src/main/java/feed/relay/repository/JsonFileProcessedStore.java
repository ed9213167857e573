package feed.relay.repository;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProcessedStore} backed by {@code processed_items.json}: {@code {"<destination>": ["<itemId>", ...]}}.
 * <p>
 * Reservations are persisted as soon as they are made. After a restart every persisted id counts as
 * processed, an interrupted delivery is not repeated.
 */
public class JsonFileProcessedStore extends AbstractJsonFileStore implements ProcessedStore {

    private static final Log log = LogFactory.get();

    private final Map<String, Set<String>> processed = new ConcurrentHashMap<>();

    // reserved in this process, not yet confirmed
    private final Map<String, Set<String>> pending = new ConcurrentHashMap<>();

    public JsonFileProcessedStore(Vertx vertx, Path file) {
        super(vertx, file);
    }

    @Override
    public Future<Void> init() {
        return readFile()
                .onSuccess(json -> {
                    processed.clear();
                    json.forEach(entry -> {
                        Set<String> ids = itemsOf(entry.getKey(), processed);
                        if (entry.getValue() instanceof JsonArray array) {
                            array.forEach(id -> ids.add(String.valueOf(id)));
                        }
                    });
                    log.info("Loaded processed items of {} destination(s) from {}", processed.size(), file);
                })
                .mapEmpty();
    }

    @Override
    public boolean isNew(String destinationId, String itemId) {
        Set<String> ids = processed.get(destinationId);
        return ids == null || !ids.contains(itemId);
    }

    @Override
    public Future<Boolean> reserve(String destinationId, String itemId) {
        if (!itemsOf(destinationId, processed).add(itemId)) {
            return Future.succeededFuture(false);
        }
        itemsOf(destinationId, pending).add(itemId);
        return flush(this::snapshot)
                .map(true)
                .recover(err -> {
                    itemsOf(destinationId, processed).remove(itemId);
                    itemsOf(destinationId, pending).remove(itemId);
                    return Future.failedFuture(err);
                });
    }

    @Override
    public Future<Void> release(String destinationId, String itemId) {
        if (!itemsOf(destinationId, pending).remove(itemId)) {
            return Future.succeededFuture();
        }
        itemsOf(destinationId, processed).remove(itemId);
        log.debug("Released {} for {}", itemId, destinationId);
        return flush(this::snapshot);
    }

    @Override
    public Future<Void> confirm(String destinationId, Collection<String> itemIds) {
        itemsOf(destinationId, pending).removeAll(itemIds);
        return Future.succeededFuture();
    }

    @Override
    public Set<String> processed(String destinationId) {
        return Set.copyOf(processed.getOrDefault(destinationId, Set.of()));
    }

    private static Set<String> itemsOf(String destinationId, Map<String, Set<String>> map) {
        return map.computeIfAbsent(destinationId, k -> ConcurrentHashMap.newKeySet());
    }

    private JsonObject snapshot() {
        JsonObject json = new JsonObject();
        new TreeMap<>(processed).forEach((destinationId, ids) -> {
            if (!ids.isEmpty()) {
                json.put(destinationId, new JsonArray(ids.stream().sorted().toList()));
            }
        });
        return json;
    }
}
