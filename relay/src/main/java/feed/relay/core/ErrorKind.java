package feed.relay.core;

/**
 * Failure classes shared by fetching and delivery.
 * <p>
 * Only {@link #TRANSIENT_NETWORK} is worth another attempt in the same delivery cycle;
 * everything else is either permanent for the item or handled by the next tick.
 */
public enum ErrorKind {
    /**
     * Timeouts, connection resets, non-200 responses. Retried next attempt or next tick.
     */
    TRANSIENT_NETWORK,
    /**
     * The item has nothing deliverable. Never retried for that item.
     */
    CONTENT_UNAVAILABLE,
    /**
     * The source handle does not resolve. The subscription stays but yields nothing.
     */
    RESOLUTION_FAILURE,
    /**
     * The destination refused the message permanently, e.g. an unknown chat.
     */
    DELIVERY_REJECTED,
    /**
     * Local disk write or delete failed.
     */
    LOCAL_IO_FAILURE;

    public boolean isRetryable() {
        return this == TRANSIENT_NETWORK;
    }
}
