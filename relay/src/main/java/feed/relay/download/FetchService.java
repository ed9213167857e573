package feed.relay.download;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.convert.Convert;
import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.ServiceContext;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import feed.relay.core.RelayConfig;
import feed.relay.delivery.DeliverableArtifact;
import feed.relay.delivery.Delivery;
import feed.relay.source.MediaDescriptor;
import feed.relay.source.SourceRef;
import feed.relay.util.Futures;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.file.FileSystem;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns an item id into local artifacts.
 * <p>
 * Files already present under {@code <downloadPath>/<handle>_<uid>/} are reused. Otherwise the item is
 * resolved and its media downloaded: a single video as {@code <itemId>.mp4}, images as
 * {@code <itemId>_<n>.jpg}. Only one fetch per item id runs at a time in this process.
 */
public class FetchService {

    private static final Log log = LogFactory.get();

    private final Vertx vertx;

    private final ServiceContext context;

    private final MediaDownloader downloader;

    private final Path downloadRoot;

    private final List<String> nonDeliverableDomains;

    private final long networkTimeoutMs;

    public FetchService(Vertx vertx, ServiceContext context, MediaDownloader downloader, RelayConfig config) {
        this.vertx = vertx;
        this.context = context;
        this.downloader = downloader;
        this.downloadRoot = Path.of(config.downloadPath());
        this.nonDeliverableDomains = config.nonDeliverableDomains();
        this.networkTimeoutMs = config.networkTimeoutMs();
    }

    public Future<Delivery> fetch(SourceRef source, String itemId) {
        return context.inFlightGuard().guard(itemId, () -> fetchUnguarded(source, itemId));
    }

    public Path itemDirectory(SourceRef source) {
        return downloadRoot.resolve(source.directoryName());
    }

    private Future<Delivery> fetchUnguarded(SourceRef source, String itemId) {
        Path directory = itemDirectory(source);
        return cached(directory, itemId)
                .compose(cached -> {
                    if (cached.isPresent()) {
                        log.debug("Cache hit for {} in {}", itemId, directory);
                        return Future.succeededFuture(cached.get());
                    }
                    return resolveAndDownload(directory, itemId);
                });
    }

    private Future<Optional<Delivery>> cached(Path directory, String itemId) {
        FileSystem fs = vertx.fileSystem();
        String video = directory.resolve(itemId + ".mp4").toString();
        return fs.exists(video)
                .compose(videoExists -> {
                    if (videoExists) {
                        return Future.succeededFuture(Optional.<Delivery>of(
                                new Delivery.SingleVideo(DeliverableArtifact.video(Path.of(video), itemId))));
                    }
                    return fs.exists(directory.toString())
                            .compose(dirExists -> dirExists
                                    ? fs.readDir(directory.toString(), imagePattern(itemId))
                                    : Future.succeededFuture(List.<String>of()))
                            .map(files -> {
                                if (CollUtil.isEmpty(files)) {
                                    return Optional.<Delivery>empty();
                                }
                                List<DeliverableArtifact> photos = files.stream()
                                        .sorted(Comparator.comparingInt(FetchService::imageIndex))
                                        .map(file -> DeliverableArtifact.photo(Path.of(file), itemId))
                                        .toList();
                                return Optional.of(Delivery.ofPhotos(itemId, photos));
                            });
                });
    }

    private Future<Delivery> resolveAndDownload(Path directory, String itemId) {
        return Futures.withTimeout(vertx, context.mediaResolver().resolveMedia(itemId), networkTimeoutMs, "Resolve " + itemId)
                .recover(err -> Future.failedFuture(FetchException.wrap(err, FetchFailure.NETWORK_FAILURE, "Resolve " + itemId)))
                .compose(descriptor -> {
                    if (descriptor instanceof MediaDescriptor.ImageSet imageSet) {
                        return downloadImages(directory, itemId, imageSet.urls());
                    }
                    if (descriptor instanceof MediaDescriptor.SingleMedia single) {
                        return downloadSingle(directory, itemId, single.url());
                    }
                    return Future.failedFuture(new FetchException(FetchFailure.NO_DOWNLOADABLE_MEDIA, "item " + itemId + " has no media"));
                });
    }

    private Future<Delivery> downloadSingle(Path directory, String itemId, String url) {
        if (StrUtil.isBlank(url)) {
            return Future.failedFuture(new FetchException(FetchFailure.NO_DOWNLOADABLE_MEDIA, "item " + itemId + " has no media URL"));
        }
        if (isNonDeliverable(url)) {
            log.info("Item {} only links to non-deliverable media, skipped: {}", itemId, url);
            return Future.failedFuture(new FetchException(FetchFailure.NO_DOWNLOADABLE_MEDIA, "item " + itemId + " is audio only"));
        }
        return downloader.download(url, directory.resolve(itemId + ".mp4"))
                .map(path -> new Delivery.SingleVideo(DeliverableArtifact.video(path, itemId)));
    }

    private Future<Delivery> downloadImages(Path directory, String itemId, List<String> urls) {
        List<DeliverableArtifact> photos = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            Path target = directory.resolve("%s_%d.jpg".formatted(itemId, i + 1));
            chain = chain.compose(v -> downloader.download(url, target)
                    .onSuccess(path -> photos.add(DeliverableArtifact.photo(path, itemId)))
                    .<Void>mapEmpty()
                    .recover(err -> {
                        log.warn("Image {} of item {} dropped: {}", target.getFileName(), itemId, err.getMessage());
                        return Future.succeededFuture();
                    }));
        }
        return chain.compose(v -> {
            if (photos.isEmpty()) {
                return Future.failedFuture(new FetchException(FetchFailure.NO_DOWNLOADABLE_MEDIA,
                        "none of the %d image(s) of item %s could be downloaded".formatted(urls.size(), itemId)));
            }
            if (photos.size() < urls.size()) {
                log.info("Item {}: {} of {} image(s) downloaded", itemId, photos.size(), urls.size());
            }
            return Future.succeededFuture(Delivery.ofPhotos(itemId, photos));
        });
    }

    private boolean isNonDeliverable(String url) {
        return nonDeliverableDomains.stream().anyMatch(url::contains);
    }

    private static String imagePattern(String itemId) {
        return Pattern.quote(itemId) + "_\\d+\\.jpg";
    }

    private static int imageIndex(String file) {
        String name = FileUtil.mainName(file);
        return Convert.toInt(StrUtil.subAfter(name, "_", true), 0);
    }
}
