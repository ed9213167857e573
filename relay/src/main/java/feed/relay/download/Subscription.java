package feed.relay.download;

import feed.relay.channel.Destination;
import feed.relay.repository.Watermark;

/**
 * One (destination, source) pair as read at the start of a tick.
 */
public record Subscription(String destinationId, Long topicId, String handle, Watermark watermark) {

    public Destination destination() {
        return new Destination(destinationId, topicId);
    }

    public String key() {
        return destinationId + "/" + handle;
    }
}
