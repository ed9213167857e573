package feed.relay.delivery;

import java.nio.file.Path;

/**
 * A downloaded file ready to be sent. It is deleted once its batch has been sent.
 */
public record DeliverableArtifact(Path path, String itemId, Kind kind) {

    public enum Kind {
        PHOTO,
        VIDEO
    }

    public static DeliverableArtifact photo(Path path, String itemId) {
        return new DeliverableArtifact(path, itemId, Kind.PHOTO);
    }

    public static DeliverableArtifact video(Path path, String itemId) {
        return new DeliverableArtifact(path, itemId, Kind.VIDEO);
    }

    public boolean isPhoto() {
        return kind == Kind.PHOTO;
    }
}
