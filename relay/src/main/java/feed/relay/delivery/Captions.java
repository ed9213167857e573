package feed.relay.delivery;

import cn.hutool.core.util.StrUtil;

public class Captions {

    private static final String HASH = "#";

    public static String hashtag(String handle) {
        return HASH + handle;
    }

    public static String total(String handle, int count) {
        return "%s (total %d)".formatted(hashtag(handle), count);
    }

    /**
     * The handle a caption was built for, e.g. {@code acct} from {@code #acct (total 3)}.
     */
    public static String handleOf(String caption) {
        if (StrUtil.isBlank(caption) || !caption.startsWith(HASH)) {
            return null;
        }
        String handle = StrUtil.subBefore(caption.substring(HASH.length()), " ", false);
        return StrUtil.emptyToNull(StrUtil.trim(handle));
    }
}
