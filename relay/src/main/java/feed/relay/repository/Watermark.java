package feed.relay.repository;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Newest item delivered for one (destination, source) pair.
 *
 * @param itemId    id of that item, empty right after subscribing
 * @param createdAt its creation time in seconds, null for watermarks recorded without a time
 */
public record Watermark(String itemId, Long createdAt) {

    public static final Watermark EMPTY = new Watermark("", null);

    @JsonIgnore
    public boolean isEmpty() {
        return StrUtil.isBlank(itemId);
    }

    @JsonIgnore
    public boolean hasTime() {
        return createdAt != null;
    }
}
