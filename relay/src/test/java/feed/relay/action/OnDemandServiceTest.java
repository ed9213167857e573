package feed.relay.action;

import feed.relay.Collaborators;
import feed.relay.FakeSources;
import feed.relay.RecordingChannel;
import feed.relay.RecordingChannel.Type;
import feed.relay.ServiceContext;
import feed.relay.channel.Destination;
import feed.relay.core.DeliveryException;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import feed.relay.core.RelayConfig;
import feed.relay.delivery.DeliverableArtifact;
import feed.relay.delivery.Delivery;
import feed.relay.delivery.DeliveryDispatcher;
import feed.relay.download.FetchService;
import feed.relay.download.InFlightGuard;
import feed.relay.download.MediaDownloader;
import feed.relay.repository.JsonFileProcessedStore;
import feed.relay.source.ListedItem;
import feed.relay.source.MediaVariant;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static feed.relay.TestFutures.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OnDemandServiceTest {

    @TempDir
    Path dir;

    private Vertx vertx;

    private HttpServer server;

    private String baseUrl;

    private FakeSources sources;

    private RecordingChannel channel;

    private JsonFileProcessedStore processedStore;

    private ReferenceTokenRegistry registry;

    private FetchService fetchService;

    private MediaDownloader downloader;

    private OnDemandService service;

    private final Destination requester = Destination.of("u1");

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = vertx.createHttpServer().requestHandler(req -> {
            switch (req.path()) {
                case "/hd.mp4" -> req.response().end("hd-bytes");
                case "/audio.mp3" -> req.response().end("mp3-bytes");
                default -> req.response().setStatusCode(404).end();
            }
        });
        await(server.listen(0));
        baseUrl = "http://localhost:" + server.actualPort();

        sources = new FakeSources();
        sources.withSource("acct", new ListedItem("v1", "10"));
        channel = new RecordingChannel();
        processedStore = new JsonFileProcessedStore(vertx, dir.resolve("processed_items.json"));
        await(processedStore.init());
        registry = new ReferenceTokenRegistry(6);
        RelayConfig config = RelayConfig.fromJson(JsonObject.of(
                "downloadPath", dir.toString(),
                "retryDelayMs", 5,
                "networkTimeoutMs", 2000));
        ServiceContext context = new ServiceContext(processedStore, null, registry, new InFlightGuard(),
                new Collaborators(sources, sources, sources, channel));
        fetchService = mock(FetchService.class);
        when(fetchService.fetch(any(), anyString())).thenAnswer(inv -> videoFuture(inv.getArgument(1)));
        downloader = new MediaDownloader(vertx, config.networkTimeoutMs());
        DeliveryDispatcher dispatcher = new DeliveryDispatcher(vertx, channel, registry, sources, config);
        service = new OnDemandService(vertx, context, fetchService, dispatcher, downloader, config);
    }

    @AfterEach
    void tearDown() throws Exception {
        downloader.close();
        await(vertx.close());
    }

    private Future<Delivery> videoFuture(String itemId) {
        try {
            Path path = Files.writeString(dir.resolve(itemId + ".mp4"), itemId);
            return Future.succeededFuture(new Delivery.SingleVideo(DeliverableArtifact.video(path, itemId)));
        } catch (Exception e) {
            return Future.failedFuture(e);
        }
    }

    private long variantFiles() throws Exception {
        Path variants = dir.resolve("variants");
        if (!Files.exists(variants)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(variants)) {
            return files.count();
        }
    }

    @Test
    void manualFetchDeliversOnce() throws Exception {
        ActionOutcome first = await(service.fetchAndDeliver("acct", "v1", requester));

        assertThat(first).isEqualTo(ActionOutcome.ok(ActionOutcome.DELIVERED));
        assertThat(channel.sent(Type.SINGLE)).singleElement()
                .satisfies(call -> assertThat(call.text()).isEqualTo("#acct"));
        assertThat(processedStore.processed("u1")).containsExactly("v1");

        ActionOutcome second = await(service.fetchAndDeliver("acct", "v1", requester));

        assertThat(second).isEqualTo(ActionOutcome.failed(ActionOutcome.ALREADY_DELIVERED));
        verify(fetchService, times(1)).fetch(any(), anyString());
    }

    @Test
    void manualFetchWithoutMedia() throws Exception {
        when(fetchService.fetch(any(), anyString()))
                .thenReturn(Future.failedFuture(new FetchException(FetchFailure.NO_DOWNLOADABLE_MEDIA, "v1")));

        ActionOutcome outcome = await(service.fetchAndDeliver("acct", "v1", requester));

        assertThat(outcome).isEqualTo(ActionOutcome.failed("No media found"));
        assertThat(processedStore.isNew("u1", "v1")).isTrue();
        assertThat(channel.attempts).isEmpty();
    }

    @Test
    void manualFetchOfUnknownSource() throws Exception {
        ActionOutcome outcome = await(service.fetchAndDeliver("ghost", "v1", requester));

        assertThat(outcome).isEqualTo(ActionOutcome.failed(FetchFailure.USER_RESOLUTION_FAILED.userMessage()));
        assertThat(processedStore.isNew("u1", "v1")).isTrue();
    }

    @Test
    void rejectedManualDeliveryIsReleased() throws Exception {
        channel.failNext(DeliveryException.rejected("u1", "blocked"));

        ActionOutcome outcome = await(service.fetchAndDeliver("acct", "v1", requester));

        assertThat(outcome.success()).isFalse();
        assertThat(processedStore.isNew("u1", "v1")).isTrue();
        assertThat(Files.exists(dir.resolve("v1.mp4"))).isFalse();
    }

    @Test
    void hdTokenSendsFilesOnlyOnce() throws Exception {
        sources.variants.put("v1:" + MediaVariant.HD, baseUrl + "/hd.mp4");
        sources.variants.put("v2:" + MediaVariant.HD, baseUrl + "/hd.mp4");
        String token = registry.register(ActionKind.HD, List.of("v1", "v2"));
        String data = CallbackData.encode(ActionKind.HD, token);

        ActionOutcome outcome = await(service.handleCallback(data, requester, "#acct (total 2)"));

        assertThat(outcome).isEqualTo(ActionOutcome.ok("Sent 2 of 2 file(s)"));
        assertThat(channel.sent(Type.DOCUMENT)).hasSize(2).allSatisfy(call -> {
            assertThat(call.filesPresent()).isTrue();
            assertThat(call.text()).isEqualTo("#acct");
            assertThat(call.files().get(0).getFileName().toString()).startsWith("HD_").endsWith(".mp4");
        });
        assertThat(variantFiles()).isZero();

        ActionOutcome again = await(service.handleCallback(data, requester, "#acct (total 2)"));

        assertThat(again).isEqualTo(ActionOutcome.failed(ActionOutcome.EXPIRED));
        assertThat(channel.sent(Type.DOCUMENT)).hasSize(2);
    }

    @Test
    void rawItemIdIsUsedAsIs() throws Exception {
        sources.variants.put("v7:" + MediaVariant.AUDIO, baseUrl + "/audio.mp3");

        ActionOutcome outcome = await(service.handleCallback("audio_url|v7", requester, "#acct"));

        assertThat(outcome.success()).isTrue();
        assertThat(channel.sent(Type.DOCUMENT)).singleElement()
                .satisfies(call -> assertThat(call.files().get(0).getFileName().toString()).startsWith("Audio_v7_").endsWith(".mp3"));
    }

    @Test
    void missingVariantIsReported() throws Exception {
        ActionOutcome outcome = await(service.handleAction(ActionKind.AUDIO, "v9", requester, "acct"));

        assertThat(outcome).isEqualTo(ActionOutcome.failed("No media found"));
        assertThat(channel.attempts).isEmpty();
    }

    @Test
    void urlTokenCanBeUsedAgain() throws Exception {
        String token = registry.register(ActionKind.VIDEO_URLS, List.of("v1", "v2"));
        String data = CallbackData.encode(ActionKind.VIDEO_URLS, token);

        ActionOutcome first = await(service.handleCallback(data, requester, "#acct"));
        ActionOutcome second = await(service.handleCallback(data, requester, "#acct"));

        assertThat(first).isEqualTo(ActionOutcome.ok("Sent 2 URL(s)"));
        assertThat(second).isEqualTo(first);
        assertThat(channel.sent(Type.MESSAGE)).extracting(RecordingChannel.Call::text).containsExactly(
                "https://example.test/@acct/video/v1",
                "https://example.test/@acct/video/v2",
                "https://example.test/@acct/video/v1",
                "https://example.test/@acct/video/v2");
    }

    @Test
    void unknownCallbackIsUnsupported() throws Exception {
        ActionOutcome outcome = await(service.handleCallback("nope|abc", requester, "#acct"));

        assertThat(outcome).isEqualTo(ActionOutcome.failed(ActionOutcome.UNSUPPORTED));
    }
}
