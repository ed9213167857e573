package feed.relay.download;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.core.RelayConfig;
import feed.relay.util.TickStatistics;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;

/**
 * Runs poll passes forever: a pass, then {@code pollIntervalMs} of idle time, then the next pass.
 * The next pass is only scheduled once the previous one has finished, so passes never overlap.
 */
public class SubscriptionPollVerticle extends AbstractVerticle {

    private static final Log log = LogFactory.get();

    private final SubscriptionPoller poller;

    private final RelayConfig config;

    private volatile boolean stopped = false;

    private volatile long timerId = -1;

    private Future<TickStatistics> currentPass = Future.succeededFuture(TickStatistics.empty());

    private long passes = 0;

    public SubscriptionPollVerticle(SubscriptionPoller poller, RelayConfig config) {
        this.poller = poller;
        this.config = config;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        schedule(0);
        log.info("""
                Subscription poll verticle started!
                |Poll interval: %s ms
                |Batch size: %s subscriptions
                |Batch pause: %s ms
                |Freshness window: %s s
                """.formatted(config.pollIntervalMs(),
                config.pollBatchSize(),
                config.pollBatchPauseMs(),
                config.freshnessWindowSeconds()));
        startPromise.complete();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        stopped = true;
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
        // let a running pass reach its next checkpoint
        currentPass.onComplete(ar -> {
            log.info("Subscription poll verticle stopped after %d pass(es)".formatted(passes));
            stopPromise.complete();
        });
    }

    public boolean isStopped() {
        return stopped;
    }

    private void schedule(long delayMs) {
        if (stopped) {
            return;
        }
        if (delayMs <= 0) {
            runPass();
            return;
        }
        timerId = vertx.setTimer(delayMs, id -> {
            timerId = -1;
            runPass();
        });
    }

    private void runPass() {
        if (stopped) {
            return;
        }
        passes++;
        currentPass = poller.runPass(() -> stopped)
                .onFailure(err -> log.error(err, "Poll pass {} failed", passes))
                .onComplete(ar -> schedule(config.pollIntervalMs()));
    }
}
