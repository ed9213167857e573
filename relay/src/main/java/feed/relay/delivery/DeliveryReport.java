package feed.relay.delivery;

import feed.relay.core.DeliveryException;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Outcome of sending the artifacts of one or more items.
 *
 * @param deliveredItemIds   items with at least one artifact sent, oldest first; they are never sent again
 * @param undeliveredItemIds items none of whose artifacts went out
 * @param failure            the error that stopped sending, null when everything went out
 */
public record DeliveryReport(List<String> deliveredItemIds, List<String> undeliveredItemIds, Throwable failure) {

    public DeliveryReport {
        deliveredItemIds = List.copyOf(deliveredItemIds);
        undeliveredItemIds = List.copyOf(undeliveredItemIds);
    }

    public static DeliveryReport delivered(List<String> itemIds) {
        return new DeliveryReport(itemIds, List.of(), null);
    }

    public static DeliveryReport failed(List<String> itemIds, Throwable failure) {
        return new DeliveryReport(List.of(), itemIds, failure);
    }

    public boolean isComplete() {
        return failure == null && undeliveredItemIds.isEmpty();
    }

    /**
     * The destination refused the content, retrying later is pointless.
     */
    public boolean isRejected() {
        return DeliveryException.isPermanent(failure);
    }

    public JsonObject toJson() {
        return JsonObject.of(
                "delivered", deliveredItemIds,
                "undelivered", undeliveredItemIds,
                "rejected", isRejected(),
                "error", failure == null ? null : failure.getMessage()
        );
    }
}
