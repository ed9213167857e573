package feed.relay.channel;

/**
 * An affordance attached to a message: either a plain link or a callback carrying a token.
 */
public record ActionButton(String label, String url, String callbackPrefix, String token) {

    public static ActionButton link(String label, String url) {
        return new ActionButton(label, url, null, null);
    }

    public static ActionButton callback(String label, String callbackPrefix, String token) {
        return new ActionButton(label, null, callbackPrefix, token);
    }

    public boolean isLink() {
        return url != null;
    }

    /**
     * Wire form of a callback button, e.g. {@code hd_url|hd_k3x9q2}.
     */
    public String callbackData() {
        return isLink() ? null : callbackPrefix + "|" + token;
    }
}
