package feed.relay.download;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.core.FetchException;
import feed.relay.core.FetchFailure;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.nio.file.Path;

/**
 * Downloads a media URL to a local file.
 */
public class MediaDownloader {

    private static final Log log = LogFactory.get();

    public static final String USER_AGENT = "Mozilla/5.0";

    private final Vertx vertx;

    private final WebClient webClient;

    private final long timeoutMs;

    public MediaDownloader(Vertx vertx, long timeoutMs) {
        this(vertx, WebClient.create(vertx, new WebClientOptions()
                .setUserAgent(USER_AGENT)
                .setFollowRedirects(true)), timeoutMs);
    }

    public MediaDownloader(Vertx vertx, WebClient webClient, long timeoutMs) {
        this.vertx = vertx;
        this.webClient = webClient;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Transport errors, timeouts and non-200 answers fail with {@link FetchFailure#NETWORK_FAILURE},
     * a file that cannot be written with {@link FetchFailure#WRITE_FAILURE}.
     */
    public Future<Path> download(String url, Path target) {
        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .recover(err -> Future.failedFuture(
                        new FetchException(FetchFailure.NETWORK_FAILURE, "GET %s: %s".formatted(url, err.getMessage()), err)))
                .compose(response -> bodyOf(url, response))
                .compose(body -> write(target, body))
                .onSuccess(path -> log.debug("Downloaded {} -> {}", url, path));
    }

    private Future<Buffer> bodyOf(String url, HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            return Future.failedFuture(new FetchException(FetchFailure.NETWORK_FAILURE,
                    "GET %s returned %d".formatted(url, response.statusCode())));
        }
        Buffer body = response.body();
        if (body == null || body.length() == 0) {
            return Future.failedFuture(new FetchException(FetchFailure.NETWORK_FAILURE, "GET %s returned no content".formatted(url)));
        }
        return Future.succeededFuture(body);
    }

    private Future<Path> write(Path target, Buffer body) {
        Path parent = target.toAbsolutePath().getParent();
        return vertx.fileSystem().mkdirs(parent.toString())
                .compose(v -> vertx.fileSystem().writeFile(target.toString(), body))
                .map(target)
                .recover(err -> Future.failedFuture(
                        new FetchException(FetchFailure.WRITE_FAILURE, "write %s: %s".formatted(target, err.getMessage()), err)));
    }

    public void close() {
        webClient.close();
    }
}
