package feed.relay.core;

import feed.relay.delivery.RetryPolicy;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Typed view over the verticle configuration. Every key is optional.
 *
 * @param dataPath               directory holding processed_items.json and subscriptions.json
 * @param downloadPath           scratch directory for downloaded artifacts
 * @param pollIntervalMs         idle time between two poll passes
 * @param pollBatchSize          subscriptions polled before a pause
 * @param pollBatchPauseMs       pause between two subscription batches
 * @param freshnessWindowSeconds items older than this relative to now are ignored
 * @param mediaGroupLimit        maximum artifacts per media group message
 * @param retryAttempts          send attempts per batch
 * @param retryDelayMs           fixed delay between send attempts
 * @param networkTimeoutMs       timeout applied to every network call
 * @param photoSetPauseMs        pause between media groups of a single image set
 * @param nonDeliverableDomains  media URL fragments that are never downloaded
 * @param tokenSuffixLength      random characters in a reference token
 * @param tokenCapacity          reference tokens kept at most; the least recently used goes first
 * @param tokenTtlMs             lifetime of a reference token
 */
public record RelayConfig(
        String dataPath,
        String downloadPath,
        long pollIntervalMs,
        int pollBatchSize,
        long pollBatchPauseMs,
        long freshnessWindowSeconds,
        int mediaGroupLimit,
        int retryAttempts,
        long retryDelayMs,
        long networkTimeoutMs,
        long photoSetPauseMs,
        List<String> nonDeliverableDomains,
        int tokenSuffixLength,
        int tokenCapacity,
        long tokenTtlMs
) {

    public static final String PROCESSED_ITEMS_FILE = "processed_items.json";

    public static final String SUBSCRIPTIONS_FILE = "subscriptions.json";

    public static final List<String> DEFAULT_NON_DELIVERABLE_DOMAINS = List.of("sf16-ies-music-va.tiktokcdn.com");

    public static RelayConfig defaults() {
        return fromJson(new JsonObject());
    }

    public static RelayConfig fromJson(JsonObject json) {
        JsonArray domains = json.getJsonArray("nonDeliverableDomains");
        return new RelayConfig(
                json.getString("dataPath", Config.DATA_PATH),
                json.getString("downloadPath", Config.DOWNLOAD_PATH),
                json.getLong("pollIntervalMs", 200_000L),
                json.getInteger("pollBatchSize", 10),
                json.getLong("pollBatchPauseMs", 10_000L),
                json.getLong("freshnessWindowSeconds", 86_400L),
                json.getInteger("mediaGroupLimit", 10),
                json.getInteger("retryAttempts", 3),
                json.getLong("retryDelayMs", 1_000L),
                json.getLong("networkTimeoutMs", 15_000L),
                json.getLong("photoSetPauseMs", 500L),
                domains == null
                        ? DEFAULT_NON_DELIVERABLE_DOMAINS
                        : domains.stream().map(String::valueOf).toList(),
                json.getInteger("tokenSuffixLength", 6),
                json.getInteger("tokenCapacity", 10_000),
                json.getLong("tokenTtlMs", 86_400_000L)
        );
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("dataPath", dataPath)
                .put("downloadPath", downloadPath)
                .put("pollIntervalMs", pollIntervalMs)
                .put("pollBatchSize", pollBatchSize)
                .put("pollBatchPauseMs", pollBatchPauseMs)
                .put("freshnessWindowSeconds", freshnessWindowSeconds)
                .put("mediaGroupLimit", mediaGroupLimit)
                .put("retryAttempts", retryAttempts)
                .put("retryDelayMs", retryDelayMs)
                .put("networkTimeoutMs", networkTimeoutMs)
                .put("photoSetPauseMs", photoSetPauseMs)
                .put("nonDeliverableDomains", new JsonArray(nonDeliverableDomains))
                .put("tokenSuffixLength", tokenSuffixLength)
                .put("tokenCapacity", tokenCapacity)
                .put("tokenTtlMs", tokenTtlMs);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, Duration.ofMillis(retryDelayMs));
    }

    public Path processedItemsFile() {
        return Path.of(dataPath, PROCESSED_ITEMS_FILE);
    }

    public Path subscriptionsFile() {
        return Path.of(dataPath, SUBSCRIPTIONS_FILE);
    }
}
