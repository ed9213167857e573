package feed.relay.core;

public enum FetchFailure {
    USER_RESOLUTION_FAILED(ErrorKind.RESOLUTION_FAILURE, "Source could not be resolved"),
    NO_VIDEO_LISTING(ErrorKind.TRANSIENT_NETWORK, "No item listing available"),
    NETWORK_FAILURE(ErrorKind.TRANSIENT_NETWORK, "Download failed, try again later"),
    NO_DOWNLOADABLE_MEDIA(ErrorKind.CONTENT_UNAVAILABLE, "No media found"),
    WRITE_FAILURE(ErrorKind.LOCAL_IO_FAILURE, "Could not store the downloaded media"),
    // another caller holds the item; it is eligible again on the next tick
    ALREADY_IN_FLIGHT(ErrorKind.TRANSIENT_NETWORK, "Item is already being downloaded");

    private final ErrorKind kind;

    private final String userMessage;

    FetchFailure(ErrorKind kind, String userMessage) {
        this.kind = kind;
        this.userMessage = userMessage;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String userMessage() {
        return userMessage;
    }
}
