package feed.relay.util;

import cn.hutool.core.convert.Convert;
import cn.hutool.core.util.StrUtil;

import java.time.Clock;
import java.util.Optional;

/**
 * Date handling for source listings.
 * <p>
 * Date Standards:
 * - Source creation times: seconds since epoch, delivered as strings by the listing
 * - Watermarks: seconds since epoch (long)
 * - Freshness window: seconds
 * <p>
 * Key Principle: both sides of every comparison are in seconds.
 */
public class DateUtils {

    /**
     * Parse a creation time as returned by a listing.
     *
     * @param raw creation time, e.g. "1718000000"
     * @return seconds since epoch, or empty when the value is missing, not numeric, or negative
     */
    public static Optional<Long> parseSourceSeconds(String raw) {
        if (StrUtil.isBlank(raw)) {
            return Optional.empty();
        }
        Long seconds = Convert.toLong(StrUtil.trim(raw), null);
        if (seconds == null || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(seconds);
    }

    public static long currentSourceSeconds(Clock clock) {
        return clock.millis() / 1000L;
    }

    /**
     * @return true if the item was created at most {@code windowSeconds} before {@code nowSeconds}
     */
    public static boolean isWithinFreshnessWindow(long createdAtSeconds, long nowSeconds, long windowSeconds) {
        return nowSeconds - createdAtSeconds <= windowSeconds;
    }

    /**
     * @return true if the item is strictly newer than the watermark
     */
    public static boolean isAfterWatermark(long createdAtSeconds, long watermarkSeconds) {
        return createdAtSeconds > watermarkSeconds;
    }
}
