package feed.relay.delivery;

import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;
import feed.relay.core.DeliveryException;
import feed.relay.util.Futures;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Fixed-delay retry for outbound sends. Permanent rejections are returned after the first attempt.
 *
 * @param attempts total attempts, at least 1
 * @param delay    pause between two attempts, constant
 */
public record RetryPolicy(int attempts, Duration delay) {

    private static final Log log = LogFactory.get();

    public RetryPolicy {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1, got " + attempts);
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public <T> Future<T> execute(Vertx vertx, Supplier<Future<T>> action, String context) {
        return attempt(vertx, action, context, 1);
    }

    private <T> Future<T> attempt(Vertx vertx, Supplier<Future<T>> action, String context, int attempt) {
        Future<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            future = Future.failedFuture(e);
        }
        return future.recover(err -> {
            if (DeliveryException.isPermanent(err)) {
                log.warn("{} rejected: {}", context, err.getMessage());
                return Future.failedFuture(err);
            }
            if (attempt >= attempts) {
                log.warn("{} failed after {} attempt(s): {}", context, attempt, err.getMessage());
                return Future.failedFuture(err);
            }
            log.debug("{} failed (attempt {}/{}), retrying in {} ms: {}",
                    context, attempt, attempts, delay.toMillis(), err.getMessage());
            return Futures.delay(vertx, delay.toMillis())
                    .compose(v -> attempt(vertx, action, context, attempt + 1));
        });
    }
}
