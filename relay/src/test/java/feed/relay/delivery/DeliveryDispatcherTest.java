package feed.relay.delivery;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import feed.relay.FakeSources;
import feed.relay.RecordingChannel;
import feed.relay.RecordingChannel.Call;
import feed.relay.RecordingChannel.Type;
import feed.relay.action.ActionKind;
import feed.relay.action.ReferenceTokenRegistry;
import feed.relay.channel.ActionButton;
import feed.relay.channel.ActionKeyboard;
import feed.relay.channel.Destination;
import feed.relay.core.DeliveryException;
import feed.relay.core.RelayConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static feed.relay.TestFutures.await;
import static org.assertj.core.api.Assertions.assertThat;

class DeliveryDispatcherTest {

    @TempDir
    Path dir;

    private Vertx vertx;

    private RecordingChannel channel;

    private ReferenceTokenRegistry registry;

    private DeliveryDispatcher dispatcher;

    private final Destination destination = new Destination("-100200", 5L);

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        channel = new RecordingChannel();
        registry = new ReferenceTokenRegistry(6);
        RelayConfig config = RelayConfig.fromJson(JsonObject.of(
                "retryDelayMs", 5,
                "photoSetPauseMs", 0,
                "networkTimeoutMs", 2000));
        dispatcher = new DeliveryDispatcher(vertx, channel, registry, new FakeSources(), config);
    }

    @AfterEach
    void tearDown() throws Exception {
        await(vertx.close());
    }

    private DeliverableArtifact photo(String itemId, int n) throws Exception {
        Path path = Files.writeString(dir.resolve("%s_%d.jpg".formatted(itemId, n)), "img");
        return DeliverableArtifact.photo(path, itemId);
    }

    private DeliverableArtifact video(String itemId) throws Exception {
        Path path = Files.writeString(dir.resolve(itemId + ".mp4"), "video");
        return DeliverableArtifact.video(path, itemId);
    }

    private Delivery photoSet(String itemId, int count) throws Exception {
        List<DeliverableArtifact> photos = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            photos.add(photo(itemId, i));
        }
        return Delivery.ofPhotos(itemId, photos);
    }

    @Test
    void groupedItemsAreSentInBatchesOfTen() throws Exception {
        List<Delivery> deliveries = List.of(photoSet("a", 12), photoSet("b", 11));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", deliveries));

        List<Call> groups = channel.sent(Type.MEDIA_GROUP);
        assertThat(groups).extracting(call -> call.files().size()).containsExactly(10, 10, 3);
        assertThat(channel.sent(Type.SINGLE)).isEmpty();
        assertThat(groups).allMatch(Call::filesPresent);
        assertThat(report.deliveredItemIds()).containsExactly("a", "b");
        assertThat(report.isComplete()).isTrue();
        try (var files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void photoGroupSummaryOffersAudioAndUrls() throws Exception {
        await(dispatcher.deliverItems(destination, "acct", List.of(photoSet("a", 2), photoSet("b", 3))));

        Call summary = channel.sent(Type.MESSAGE).get(0);
        assertThat(summary.text()).isEqualTo("#acct");
        List<ActionButton> buttons = summary.keyboard().buttons();
        assertThat(buttons).extracting(ActionButton::callbackPrefix).containsExactly("audio_url", "video_urls");
        assertThat(registry.resolve(buttons.get(0).token())).contains(List.of("a", "b"));
        assertThat(registry.resolve(buttons.get(1).token())).contains(List.of("a", "b"));
    }

    @Test
    void videoGroupSummaryCountsArtifactsAndLinksProfile() throws Exception {
        List<Delivery> deliveries = List.of(
                new Delivery.SingleVideo(video("v1")),
                new Delivery.SingleVideo(video("v2")));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", deliveries));

        assertThat(channel.sent(Type.MEDIA_GROUP)).singleElement()
                .satisfies(call -> assertThat(call.itemIds()).containsExactly("v1", "v2"));
        Call summary = channel.sent(Type.MESSAGE).get(0);
        assertThat(summary.text()).isEqualTo("#acct (total 2)");
        assertThat(summary.destination()).isEqualTo(destination);
        List<ActionButton> buttons = summary.keyboard().buttons();
        assertThat(buttons.get(0).url()).isEqualTo("https://example.test/@acct");
        assertThat(buttons.subList(1, 4)).extracting(ActionButton::callbackPrefix)
                .containsExactly("hd_url", "audio_url", "video_urls");
        assertThat(registry.isRegistryToken(buttons.get(1).token())).isTrue();
        assertThat(registry.consumeOnce(buttons.get(1).token())).contains(List.of("v1", "v2"));
        assertThat(report.deliveredItemIds()).containsExactly("v1", "v2");
    }

    @Test
    void singleVideoUsesItemIdAsToken() throws Exception {
        await(dispatcher.deliverItems(destination, "acct", List.of(new Delivery.SingleVideo(video("v1")))));

        Call call = channel.sent(Type.SINGLE).get(0);
        assertThat(call.text()).isEqualTo("#acct");
        List<ActionButton> buttons = call.keyboard().buttons();
        assertThat(buttons.get(0).url()).isEqualTo("https://example.test/@acct/video/v1");
        assertThat(buttons.subList(1, 4)).extracting(ActionButton::callbackData)
                .containsExactly("hd_url|v1", "audio_url|v1", "video_urls|v1");
        assertThat(registry.size()).isZero();
    }

    @Test
    void singlePhotoSetIsFollowedByHashtagMessage() throws Exception {
        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", List.of(photoSet("p1", 3))));

        assertThat(channel.sent(Type.MEDIA_GROUP)).hasSize(1);
        Call message = channel.sent(Type.MESSAGE).get(0);
        assertThat(message.text()).isEqualTo("#acct");
        assertThat(message.keyboard().buttons()).extracting(ActionButton::callbackData)
                .containsExactly("audio_url|p1", "video_urls|p1");
        assertThat(report.deliveredItemIds()).containsExactly("p1");
    }

    @Test
    void failedBatchStopsRemainingBatchesAndReportsPrefix() throws Exception {
        Delivery a = photoSet("a", 10);
        Delivery b = photoSet("b", 5);
        Delivery c = new Delivery.SingleVideo(video("c"));
        DeliveryException down = DeliveryException.transientFailure(destination.destinationId(), "down", null);

        // first batch goes through, the second fails on every attempt
        RecordingChannel failingSecond = new RecordingChannel() {
            private int groups = 0;

            @Override
            public Future<Void> sendMediaGroup(Destination d, List<DeliverableArtifact> artifacts, String caption) {
                if (++groups > 1) {
                    attempts.add(new Call(Type.MEDIA_GROUP, d, List.of(), List.of(), true, caption, null));
                    return Future.failedFuture(down);
                }
                return super.sendMediaGroup(d, artifacts, caption);
            }
        };
        DeliveryDispatcher dispatcher = new DeliveryDispatcher(vertx, failingSecond, registry, new FakeSources(),
                RelayConfig.fromJson(JsonObject.of("retryDelayMs", 5, "networkTimeoutMs", 2000)));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", List.of(a, b, c)));

        assertThat(report.deliveredItemIds()).containsExactly("a");
        assertThat(report.undeliveredItemIds()).containsExactly("b", "c");
        assertThat(report.isRejected()).isFalse();
        assertThat(failingSecond.attempts).filteredOn(call -> call.type() == Type.MEDIA_GROUP).hasSize(4);
        Call summary = failingSecond.sent(Type.MESSAGE).get(0);
        assertThat(summary.text()).isEqualTo("#acct");
        assertThat(registry.resolve(summary.keyboard().buttons().get(1).token())).contains(List.of("a"));
        try (var files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void itemWithPhotosInConfirmedBatchCountsAsDelivered() throws Exception {
        Delivery a = photoSet("a", 8);
        Delivery b = photoSet("b", 5);
        Delivery c = new Delivery.SingleVideo(video("c"));
        DeliveryException down = DeliveryException.transientFailure(destination.destinationId(), "down", null);
        // batch one holds a1..a8, b1, b2; batch two holds b3..b5 and fails every attempt
        RecordingChannel failingSecond = new RecordingChannel() {
            private int groups = 0;

            @Override
            public Future<Void> sendMediaGroup(Destination d, List<DeliverableArtifact> artifacts, String caption) {
                if (++groups > 1) {
                    attempts.add(new Call(Type.MEDIA_GROUP, d, List.of(), List.of(), true, caption, null));
                    return Future.failedFuture(down);
                }
                return super.sendMediaGroup(d, artifacts, caption);
            }
        };
        DeliveryDispatcher dispatcher = new DeliveryDispatcher(vertx, failingSecond, registry, new FakeSources(),
                RelayConfig.fromJson(JsonObject.of("retryDelayMs", 5, "networkTimeoutMs", 2000)));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", List.of(a, b, c)));

        assertThat(failingSecond.sent(Type.MEDIA_GROUP)).singleElement()
                .satisfies(call -> assertThat(call.itemIds()).endsWith("b", "b").hasSize(10));
        assertThat(report.deliveredItemIds()).containsExactly("a", "b");
        assertThat(report.undeliveredItemIds()).containsExactly("c");
    }

    @Test
    void artifactThatCannotBeDeletedIsLogged() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger(DeliveryDispatcher.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            DeliverableArtifact gone = DeliverableArtifact.video(dir.resolve("gone.mp4"), "gone");

            DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", List.of(new Delivery.SingleVideo(gone))));

            assertThat(report.deliveredItemIds()).containsExactly("gone");
            assertThat(appender.list).anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("Could not delete").contains("gone.mp4");
            });
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void permanentRejectionIsNotRetriedAndSkipsSummary() throws Exception {
        channel.failNext(DeliveryException.rejected(destination.destinationId(), "bot was kicked"));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct",
                List.of(new Delivery.SingleVideo(video("v1")), new Delivery.SingleVideo(video("v2")))));

        assertThat(channel.attempts).hasSize(1);
        assertThat(channel.sent).isEmpty();
        assertThat(report.isRejected()).isTrue();
        assertThat(report.undeliveredItemIds()).containsExactly("v1", "v2");
        assertThat(registry.size()).isZero();
    }

    @Test
    void transientFailureIsRetried() throws Exception {
        DeliveryException flaky = DeliveryException.transientFailure(destination.destinationId(), "flaky", null);
        channel.failNext(flaky, flaky);

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct", List.of(new Delivery.SingleVideo(video("v1")))));

        assertThat(channel.attempts).hasSize(3);
        assertThat(report.deliveredItemIds()).containsExactly("v1");
    }

    @Test
    void captionGoesOnFirstBatchOnly() throws Exception {
        List<DeliverableArtifact> artifacts = new ArrayList<>();
        for (int i = 1; i <= 11; i++) {
            artifacts.add(photo("p", i));
        }

        ActionKeyboard actions = ActionKeyboard.column(List.of(ActionKind.AUDIO.button("p")));

        DeliveryReport report = await(dispatcher.deliver(destination, artifacts, "#acct", actions));

        assertThat(channel.sent(Type.MEDIA_GROUP).get(0).text()).isEqualTo("#acct");
        assertThat(channel.sent(Type.SINGLE).get(0).text()).isNull();
        assertThat(channel.sent(Type.MESSAGE)).singleElement()
                .satisfies(call -> assertThat(call.keyboard()).isEqualTo(actions));
        assertThat(report.deliveredItemIds()).containsExactly("p");
    }

    @Test
    void noActionMessageWithoutActions() throws Exception {
        DeliveryReport report = await(dispatcher.deliver(destination, List.of(photo("p", 1), photo("p", 2)), null, ActionKeyboard.NONE));

        assertThat(report.isComplete()).isTrue();
        assertThat(channel.sent(Type.MESSAGE)).isEmpty();
    }

    @Test
    void summaryFailureDoesNotUndoDelivery() throws Exception {
        RecordingChannel noMessages = new RecordingChannel() {
            @Override
            public Future<Void> sendMessage(Destination d, String text, ActionKeyboard actions) {
                return Future.failedFuture(DeliveryException.rejected(d.destinationId(), "no text allowed"));
            }
        };
        DeliveryDispatcher dispatcher = new DeliveryDispatcher(vertx, noMessages, registry, new FakeSources(),
                RelayConfig.fromJson(JsonObject.of("retryDelayMs", 5)));

        DeliveryReport report = await(dispatcher.deliverItems(destination, "acct",
                List.of(new Delivery.SingleVideo(video("v1")), new Delivery.SingleVideo(video("v2")))));

        assertThat(report.deliveredItemIds()).containsExactly("v1", "v2");
        assertThat(report.isComplete()).isTrue();
    }
}
