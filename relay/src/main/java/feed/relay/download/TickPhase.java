package feed.relay.download;

public enum TickPhase {
    IDLE,
    LISTING,
    FILTERING,
    DOWNLOADING,
    DELIVERING,
    COMMITTING
}
