package feed.relay.channel;

/**
 * Where a delivery goes.
 *
 * @param destinationId group or user identifier
 * @param topicId       optional thread within the group
 */
public record Destination(String destinationId, Long topicId) {

    public static Destination of(String destinationId) {
        return new Destination(destinationId, null);
    }
}
