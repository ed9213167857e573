package feed.relay.util;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.util.concurrent.TimeoutException;

public class Futures {

    /**
     * A future completed by a timer, the non-blocking replacement for a sleep.
     */
    public static Future<Void> delay(Vertx vertx, long millis) {
        if (millis <= 0) {
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        vertx.setTimer(millis, id -> promise.complete());
        return promise.future();
    }

    /**
     * Fail with a {@link TimeoutException} if {@code future} has not completed within {@code millis}.
     * The underlying operation is not cancelled, its late result is ignored.
     */
    public static <T> Future<T> withTimeout(Vertx vertx, Future<T> future, long millis, String context) {
        if (millis <= 0) {
            return future;
        }
        Promise<T> promise = Promise.promise();
        long timerId = vertx.setTimer(millis, id ->
                promise.tryFail(new TimeoutException("%s timed out after %d ms".formatted(context, millis))));
        future.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }
}
