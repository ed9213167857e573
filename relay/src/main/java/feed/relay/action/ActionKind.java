package feed.relay.action;

import feed.relay.channel.ActionButton;

import java.util.Arrays;
import java.util.Optional;

/**
 * Follow-up actions offered under a delivery.
 * <p>
 * HD and AUDIO tokens are consumed by their first use, VIDEO_URLS tokens can be used repeatedly.
 * WATCH_ORIGINAL is a plain link and never carries a token.
 */
public enum ActionKind {
    WATCH_ORIGINAL("Watch Original", null, null, false),
    HD("HD", "hd_url", "hd", true),
    AUDIO("Audio", "audio_url", "audio", true),
    VIDEO_URLS("Video URLs", "video_urls", "video_urls", false);

    private final String label;

    private final String callbackPrefix;

    private final String tokenPrefix;

    private final boolean singleUse;

    ActionKind(String label, String callbackPrefix, String tokenPrefix, boolean singleUse) {
        this.label = label;
        this.callbackPrefix = callbackPrefix;
        this.tokenPrefix = tokenPrefix;
        this.singleUse = singleUse;
    }

    public String label() {
        return label;
    }

    public String callbackPrefix() {
        return callbackPrefix;
    }

    public String tokenPrefix() {
        return tokenPrefix;
    }

    public boolean isSingleUse() {
        return singleUse;
    }

    public boolean isCallback() {
        return callbackPrefix != null;
    }

    public ActionButton button(String token) {
        return ActionButton.callback(label, callbackPrefix, token);
    }

    public static Optional<ActionKind> fromCallbackPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(kind -> kind.callbackPrefix != null && kind.callbackPrefix.equals(prefix))
                .findFirst();
    }
}
