package feed.relay.delivery;

import java.util.List;

/**
 * Result of fetching one item.
 */
public sealed interface Delivery {

    String itemId();

    List<DeliverableArtifact> artifacts();

    default boolean isAllPhotos() {
        return artifacts().stream().allMatch(DeliverableArtifact::isPhoto);
    }

    record SinglePhoto(DeliverableArtifact photo) implements Delivery {
        @Override
        public String itemId() {
            return photo.itemId();
        }

        @Override
        public List<DeliverableArtifact> artifacts() {
            return List.of(photo);
        }
    }

    record SingleVideo(DeliverableArtifact video) implements Delivery {
        @Override
        public String itemId() {
            return video.itemId();
        }

        @Override
        public List<DeliverableArtifact> artifacts() {
            return List.of(video);
        }
    }

    /**
     * Two or more images of one item, in display order.
     */
    record PhotoSet(String itemId, List<DeliverableArtifact> photos) implements Delivery {
        public PhotoSet {
            photos = List.copyOf(photos);
        }

        @Override
        public List<DeliverableArtifact> artifacts() {
            return photos;
        }
    }

    static Delivery ofPhotos(String itemId, List<DeliverableArtifact> photos) {
        return photos.size() == 1 ? new SinglePhoto(photos.get(0)) : new PhotoSet(itemId, photos);
    }
}
