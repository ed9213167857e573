package feed.relay.repository;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link ConfigurationStore} backed by {@code subscriptions.json}:
 * {@code {"<destination>": {"topicId": .., "sources": [..], "lastDelivered": {..}}}}.
 */
public class JsonFileConfigurationStore extends AbstractJsonFileStore implements ConfigurationStore {

    private static final Log log = LogFactory.get();

    private final Map<String, JsonObject> configs = new ConcurrentHashMap<>();

    public JsonFileConfigurationStore(Vertx vertx, Path file) {
        super(vertx, file);
    }

    @Override
    public Future<Void> init() {
        return readFile()
                .compose(json -> {
                    configs.clear();
                    try {
                        json.forEach(entry -> {
                            JsonObject value = entry.getValue() instanceof JsonObject object ? object : new JsonObject();
                            DestinationConfig config = DestinationConfig.fromJson(value);
                            config.destinationId = entry.getKey();
                            configs.put(entry.getKey(), config.toJson());
                        });
                    } catch (IllegalArgumentException e) {
                        return Future.failedFuture(new IllegalStateException("Invalid subscription record in %s".formatted(file), e));
                    }
                    log.info("Loaded {} destination(s) from {}", configs.size(), file);
                    return Future.<Void>succeededFuture();
                });
    }

    @Override
    public List<String> destinationIds() {
        return configs.keySet().stream().sorted().toList();
    }

    @Override
    public Future<DestinationConfig> get(String destinationId) {
        return Future.succeededFuture(read(destinationId));
    }

    @Override
    public Future<Void> save(DestinationConfig config) {
        configs.put(config.destinationId, config.toJson());
        return flush(this::snapshot);
    }

    @Override
    public Future<Void> remove(String destinationId) {
        if (configs.remove(destinationId) == null) {
            return Future.succeededFuture();
        }
        return flush(this::snapshot);
    }

    @Override
    public Future<DestinationConfig> update(String destinationId, UnaryOperator<DestinationConfig> mapper) {
        DestinationConfig updated;
        synchronized (configs) {
            updated = mapper.apply(read(destinationId));
            if (updated == null) {
                return Future.succeededFuture(read(destinationId));
            }
            updated.destinationId = destinationId;
            configs.put(destinationId, updated.toJson());
        }
        return flush(this::snapshot).map(updated);
    }

    private DestinationConfig read(String destinationId) {
        JsonObject json = configs.get(destinationId);
        return json == null ? null : DestinationConfig.fromJson(json.copy());
    }

    private JsonObject snapshot() {
        JsonObject json = new JsonObject();
        new TreeMap<>(configs).forEach((destinationId, config) -> {
            JsonObject copy = config.copy();
            copy.remove("destinationId");
            json.put(destinationId, copy);
        });
        return json;
    }
}
