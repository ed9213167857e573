package feed.relay.action;

/**
 * What to tell the requester after an on-demand operation.
 */
public record ActionOutcome(boolean success, String message) {

    public static final String DELIVERED = "Delivered";

    public static final String ALREADY_DELIVERED = "Already delivered";

    public static final String EXPIRED = "This link has expired";

    public static final String UNSUPPORTED = "Unsupported action";

    public static ActionOutcome ok(String message) {
        return new ActionOutcome(true, message);
    }

    public static ActionOutcome failed(String message) {
        return new ActionOutcome(false, message);
    }
}
