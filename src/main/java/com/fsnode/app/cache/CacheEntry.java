package com.fsnode.app.cache;

/**
 * A cached outcome: either a value or the error its computation threw, stamped with the
 * creation time in epoch millis.
 */
public record CacheEntry<T>(T value, Throwable error, long timestamp) {

    public static <T> CacheEntry<T> of(T value, long timestamp) {
        return new CacheEntry<>(value, null, timestamp);
    }

    public static <T> CacheEntry<T> ofError(Throwable error, long timestamp) {
        return new CacheEntry<>(null, error, timestamp);
    }

    public boolean failed() {
        return error != null;
    }
}
