package feed.relay.util;

import io.vertx.core.json.JsonObject;

/**
 * Counts collected for one subscription tick, or summed over a poll pass.
 */
public record TickStatistics(
        int subscriptions,
        int listed,
        int candidates,
        int fetched,
        int delivered
) {

    public static TickStatistics empty() {
        return new TickStatistics(0, 0, 0, 0, 0);
    }

    public static TickStatistics listedOnly(int listed) {
        return new TickStatistics(1, listed, 0, 0, 0);
    }

    /**
     * Candidates that did not reach the destination in this tick.
     */
    public int dropped() {
        return candidates - delivered;
    }

    public TickStatistics plus(TickStatistics other) {
        return new TickStatistics(
                subscriptions + other.subscriptions,
                listed + other.listed,
                candidates + other.candidates,
                fetched + other.fetched,
                delivered + other.delivered
        );
    }

    public JsonObject toJson() {
        return JsonObject.of(
                "subscriptions", subscriptions,
                "listed", listed,
                "candidates", candidates,
                "fetched", fetched,
                "delivered", delivered,
                "dropped", dropped()
        );
    }
}
