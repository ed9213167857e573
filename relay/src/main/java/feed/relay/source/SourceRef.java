package feed.relay.source;

import io.vertx.core.json.JsonObject;

/**
 * A resolved source account.
 *
 * @param handle     public handle, e.g. "acct"
 * @param internalId provider side identifier of the account
 * @param uid        secondary identifier, part of the download directory name
 */
public record SourceRef(String handle, String internalId, String uid) {

    public String directoryName() {
        return handle + "_" + uid;
    }

    public JsonObject toJson() {
        return JsonObject.of("handle", handle, "internalId", internalId, "uid", uid);
    }
}
