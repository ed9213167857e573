package feed.relay.source;

/**
 * One entry of a source listing.
 *
 * @param itemId     provider item identifier
 * @param createTime creation time in seconds as returned by the provider, may be malformed
 */
public record ListedItem(String itemId, String createTime) {
}
