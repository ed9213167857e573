package feed.relay.source;

import java.util.List;

/**
 * What an item turns out to contain once resolved.
 */
public sealed interface MediaDescriptor {

    record ImageSet(List<String> urls) implements MediaDescriptor {
        public ImageSet {
            urls = List.copyOf(urls);
        }
    }

    record SingleMedia(String url) implements MediaDescriptor {
    }

    record NoMedia() implements MediaDescriptor {
    }
}
