package feed.relay.repository;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Base for stores kept in memory and mirrored to one JSON file.
 * <p>
 * Writes go to a sibling temp file that is then moved over the target, so a crash leaves either the
 * old or the new content. Flushes run one after another in call order.
 */
public abstract class AbstractJsonFileStore {

    private static final Log log = LogFactory.get();

    protected final Vertx vertx;

    protected final Path file;

    private Future<Void> lastFlush = Future.succeededFuture();

    protected AbstractJsonFileStore(Vertx vertx, Path file) {
        this.vertx = vertx;
        this.file = file;
    }

    /**
     * Read the file; a missing or empty file reads as an empty object, malformed content fails.
     */
    protected Future<JsonObject> readFile() {
        FileSystem fs = vertx.fileSystem();
        String path = file.toString();
        return fs.exists(path)
                .compose(exists -> {
                    if (!exists) {
                        log.info("{} not found, starting empty", path);
                        return Future.succeededFuture(new JsonObject());
                    }
                    return fs.readFile(path).compose(this::decode);
                });
    }

    private Future<JsonObject> decode(Buffer buffer) {
        if (buffer.length() == 0 || buffer.toString().isBlank()) {
            return Future.succeededFuture(new JsonObject());
        }
        try {
            return Future.succeededFuture(buffer.toJsonObject());
        } catch (DecodeException e) {
            return Future.failedFuture(new IllegalStateException("Corrupt state file %s: %s".formatted(file, e.getMessage()), e));
        }
    }

    /**
     * Queue a write of the snapshot. The snapshot is taken when the write runs, so a queued flush always
     * writes the state current at that time.
     */
    protected synchronized Future<Void> flush(Supplier<JsonObject> snapshot) {
        lastFlush = lastFlush.transform(ar -> write(snapshot.get()));
        return lastFlush;
    }

    /**
     * Wait for the queued writes. A failed write was already logged, so the returned future always succeeds.
     */
    public synchronized Future<Void> close() {
        return lastFlush.otherwiseEmpty();
    }

    private Future<Void> write(JsonObject content) {
        FileSystem fs = vertx.fileSystem();
        String target = file.toString();
        String temp = target + ".tmp";
        Path parent = file.toAbsolutePath().getParent();
        Future<Void> ensureDir = parent == null ? Future.succeededFuture() : fs.mkdirs(parent.toString());
        return ensureDir
                .compose(v -> fs.writeFile(temp, content.toBuffer()))
                .compose(v -> fs.move(temp, target, new CopyOptions().setReplaceExisting(true).setAtomicMove(true)))
                .onFailure(err -> log.error("Write {} failed: {}", target, err.getMessage()));
    }
}
