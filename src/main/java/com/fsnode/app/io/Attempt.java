package com.fsnode.app.io;

/**
 * Outcome of a {@link RetryingOperation}: the action's result, or the fallback together with the
 * last error.
 */
public record Attempt<T>(T data, Throwable error) {

    public static <T> Attempt<T> success(T data) {
        return new Attempt<>(data, null);
    }

    public static <T> Attempt<T> failure(T fallback, Throwable error) {
        return new Attempt<>(fallback, error);
    }

    public boolean ok() {
        return error == null;
    }

    /** Classification of the error, {@code null} on success. */
    public IoErrorCode code() {
        return error == null ? null : IoErrorCode.classify(error);
    }
}
