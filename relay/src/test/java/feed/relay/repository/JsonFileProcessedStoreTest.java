package feed.relay.repository;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static feed.relay.TestFutures.await;
import static feed.relay.TestFutures.awaitFailure;
import static org.assertj.core.api.Assertions.assertThat;

class JsonFileProcessedStoreTest {

    @TempDir
    Path dir;

    private Vertx vertx;

    private Path file;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        file = dir.resolve("processed_items.json");
    }

    @AfterEach
    void tearDown() throws Exception {
        await(vertx.close());
    }

    private JsonFileProcessedStore open() throws Exception {
        JsonFileProcessedStore store = new JsonFileProcessedStore(vertx, file);
        await(store.init());
        return store;
    }

    @Test
    void reservationIsPersistedBeforeFutureCompletes() throws Exception {
        JsonFileProcessedStore store = open();

        assertThat(await(store.reserve("g1", "v1"))).isTrue();

        JsonObject onDisk = new JsonObject(Files.readString(file));
        assertThat(onDisk.getJsonArray("g1").getList()).containsExactly("v1");
        assertThat(store.isNew("g1", "v1")).isFalse();
        assertThat(store.isNew("g2", "v1")).isTrue();
    }

    @Test
    void secondReservationOfSameItemLoses() throws Exception {
        JsonFileProcessedStore store = open();

        assertThat(await(store.reserve("g1", "v1"))).isTrue();
        assertThat(await(store.reserve("g1", "v1"))).isFalse();
    }

    @Test
    void releaseRollsBackUnconfirmedReservation() throws Exception {
        JsonFileProcessedStore store = open();
        await(store.reserve("g1", "v1"));

        await(store.release("g1", "v1"));

        assertThat(store.isNew("g1", "v1")).isTrue();
        assertThat(new JsonObject(Files.readString(file)).containsKey("g1")).isFalse();
        // idempotent
        await(store.release("g1", "v1"));
    }

    @Test
    void confirmedItemCannotBeReleased() throws Exception {
        JsonFileProcessedStore store = open();
        await(store.reserve("g1", "v1"));
        await(store.confirm("g1", List.of("v1")));

        await(store.release("g1", "v1"));

        assertThat(store.isNew("g1", "v1")).isFalse();
    }

    @Test
    void restartKeepsReservationsAsProcessed() throws Exception {
        JsonFileProcessedStore first = open();
        await(first.reserve("g1", "v1"));
        await(first.reserve("g1", "v2"));
        await(first.confirm("g1", List.of("v1")));

        JsonFileProcessedStore second = open();

        assertThat(second.processed("g1")).containsExactlyInAnyOrder("v1", "v2");
        // reservations of the previous process are not releasable here
        await(second.release("g1", "v2"));
        assertThat(second.isNew("g1", "v2")).isFalse();
    }

    @Test
    void concurrentReservationsAllLandOnDisk() throws Exception {
        JsonFileProcessedStore store = open();
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(store.reserve("g1", "v" + i).toCompletionStage().toCompletableFuture());
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(new JsonObject(Files.readString(file)).getJsonArray("g1").size()).isEqualTo(20);
    }

    @Test
    void corruptFileFailsInit() throws Exception {
        Files.writeString(file, "{not json");

        Throwable err = awaitFailure(new JsonFileProcessedStore(vertx, file).init());

        assertThat(err).isInstanceOf(IllegalStateException.class).hasMessageContaining("Corrupt state file");
    }

    @Test
    void missingFileStartsEmpty() throws Exception {
        JsonFileProcessedStore store = open();

        assertThat(store.processed("g1")).isEmpty();
        assertThat(Files.exists(file)).isFalse();
    }
}
