package feed.relay.source;

/**
 * Alternate renditions that can be requested for a single item.
 */
public enum MediaVariant {
    HD(".mp4", "HD"),
    AUDIO(".mp3", "Audio");

    private final String extension;

    private final String filePrefix;

    MediaVariant(String extension, String filePrefix) {
        this.extension = extension;
        this.filePrefix = filePrefix;
    }

    public String extension() {
        return extension;
    }

    public String filePrefix() {
        return filePrefix;
    }
}
