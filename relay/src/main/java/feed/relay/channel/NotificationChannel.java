package feed.relay.channel;

import feed.relay.delivery.DeliverableArtifact;
import io.vertx.core.Future;

import java.nio.file.Path;
import java.util.List;

/**
 * Outbound transport. Every failure is a {@link feed.relay.core.DeliveryException}
 * flagged transient or permanent.
 */
public interface NotificationChannel {

    /**
     * Send two or more artifacts as one grouped message. The caption goes on the first one.
     */
    Future<Void> sendMediaGroup(Destination destination, List<DeliverableArtifact> artifacts, String caption);

    Future<Void> sendSingle(Destination destination, DeliverableArtifact artifact, String caption, ActionKeyboard actions);

    Future<Void> sendMessage(Destination destination, String text, ActionKeyboard actions);

    Future<Void> sendDocument(Destination destination, Path file, String caption);
}
