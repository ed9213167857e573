package feed.relay.core;

import java.util.StringJoiner;

/**
 * Raised by a notification channel when a send does not go through.
 * Permanent failures are rejections by the destination and are never retried.
 */
public class DeliveryException extends RuntimeException {
    private final boolean permanent;

    private final String destinationId;

    public DeliveryException(String destinationId, String message, boolean permanent, Throwable cause) {
        super(new StringJoiner(", ")
                .add("destination: " + destinationId)
                .add("permanent: " + permanent)
                .add("message: " + message)
                .toString(), cause);
        this.destinationId = destinationId;
        this.permanent = permanent;
    }

    public static DeliveryException transientFailure(String destinationId, String message, Throwable cause) {
        return new DeliveryException(destinationId, message, false, cause);
    }

    public static DeliveryException rejected(String destinationId, String message) {
        return new DeliveryException(destinationId, message, true, null);
    }

    public static boolean isPermanent(Throwable err) {
        return err instanceof DeliveryException de && de.permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public String getDestinationId() {
        return destinationId;
    }

    public ErrorKind getKind() {
        return permanent ? ErrorKind.DELIVERY_REJECTED : ErrorKind.TRANSIENT_NETWORK;
    }
}
