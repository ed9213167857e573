package feed.relay.core;

import java.util.StringJoiner;

public class FetchException extends RuntimeException {
    private final FetchFailure failure;

    public FetchException(FetchFailure failure, String message) {
        this(failure, message, null);
    }

    public FetchException(FetchFailure failure, String message, Throwable cause) {
        super(new StringJoiner(", ")
                .add("failure: " + failure)
                .add("message: " + message)
                .toString(), cause);
        this.failure = failure;
    }

    public FetchFailure getFailure() {
        return failure;
    }

    public ErrorKind getKind() {
        return failure.kind();
    }

    /**
     * Wrap any throwable as a fetch failure, keeping an existing {@link FetchException} as is.
     */
    public static FetchException wrap(Throwable err, FetchFailure fallback, String message) {
        if (err instanceof FetchException fe) {
            return fe;
        }
        return new FetchException(fallback, "%s: %s".formatted(message, err.getMessage()), err);
    }

    public static boolean hasFailure(Throwable err, FetchFailure failure) {
        return err instanceof FetchException fe && fe.failure == failure;
    }
}
