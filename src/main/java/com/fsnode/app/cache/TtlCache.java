package com.fsnode.app.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Future;

import static java.util.Objects.requireNonNull;

/**
 * Read-through cache over a single slot with a fixed freshness window.
 * <p>
 * The caller owns the slot: it passes the previous entry in and stores the returned one.
 * Errors thrown by the generator are captured in the entry instead of propagating, but a
 * captured error is never served; the next call regenerates.
 */
public final class TtlCache {

    @FunctionalInterface
    public interface Generator<T> {
        T generate() throws Exception;
    }

    private final Clock clock;

    public TtlCache() {
        this(Clock.systemUTC());
    }

    public TtlCache(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Returns {@code previous} while it is fresh and holds a value, otherwise a new entry built from
     * {@code generate}. A negative {@code maxAge} always regenerates.
     *
     * @throws IllegalStateException if the generator hands back a future that is not done yet
     */
    public <T> CacheEntry<T> get(CacheEntry<T> previous, Generator<T> generate, Duration maxAge) {
        if (previous != null && !previous.failed() && isFresh(previous, maxAge)) {
            return previous;
        }
        long now = clock.millis();
        T value;
        try {
            value = generate.generate();
        } catch (Exception e) {
            return CacheEntry.ofError(e, now);
        }
        if (value instanceof Future<?> f && !f.isDone()) {
            throw new IllegalStateException("Cache generator must complete synchronously, got an unresolved future");
        }
        return CacheEntry.of(value, now);
    }

    public boolean isFresh(CacheEntry<?> entry, Duration maxAge) {
        if (entry == null || maxAge == null || maxAge.isNegative()) return false;
        return clock.millis() - entry.timestamp() < maxAge.toMillis();
    }

    public <T> CacheEntry<T> stamp(T value) {
        return CacheEntry.of(value, clock.millis());
    }

    public <T> CacheEntry<T> stampError(Throwable error) {
        return CacheEntry.ofError(error, clock.millis());
    }
}
