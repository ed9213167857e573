package feed.relay.download;

import feed.relay.repository.Watermark;

/**
 * A listed item that passed filtering, with its parsed creation time in seconds.
 */
public record Candidate(String itemId, long createdAt) {

    public Watermark toWatermark() {
        return new Watermark(itemId, createdAt);
    }
}
