package com.fsnode.app.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an I/O action at most twice. A failure classified as transient
 * ({@link IoErrorCode#isTransient()}) is retried once after a random 100-200 ms pause; any other
 * failure stops at once. Never throws: the outcome is always an {@link Attempt}.
 */
public final class RetryingOperation {

    private static final Logger logger = LoggerFactory.getLogger(RetryingOperation.class);

    static final int MAX_ATTEMPTS = 2;
    static final long MIN_BACKOFF_MS = 100;
    static final long MAX_BACKOFF_MS = 200;

    @FunctionalInterface
    public interface IoAction<T> {
        T run() throws Exception;
    }

    @FunctionalInterface
    public interface IoTask {
        void run() throws Exception;
    }

    private RetryingOperation() {}

    // ----------------- blocking -----------------

    public static <T> Attempt<T> attempt(T fallback, IoAction<T> action) {
        Throwable error = null;
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            try {
                return Attempt.success(action.run());
            } catch (Exception e) {
                error = e;
                IoErrorCode code = IoErrorCode.classify(e);
                if (!code.isTransient() || i == MAX_ATTEMPTS - 1) break;

                long delay = backoffMillis();
                logger.debug("Transient {} ({}), retrying in {} ms", code.symbol(), e.getMessage(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return Attempt.failure(fallback, error);
    }

    public static Attempt<Void> attempt(IoTask task) {
        return attempt(null, () -> {
            task.run();
            return null;
        });
    }

    // ----------------- non-blocking -----------------

    /**
     * Same policy as {@link #attempt(Object, IoAction)} for an action that already returns a stage.
     * The pause between attempts is scheduled on {@code executor}, no thread sleeps. The returned
     * future never completes exceptionally.
     */
    public static <T> CompletableFuture<Attempt<T>> attemptAsync(
            T fallback, Supplier<? extends CompletionStage<T>> action, Executor executor) {
        return attemptAsync(fallback, action, executor, 0);
    }

    /**
     * Runs a blocking action on {@code executor} with the retry policy.
     */
    public static <T> CompletableFuture<Attempt<T>> attemptOn(T fallback, IoAction<T> action, Executor executor) {
        return attemptAsync(fallback, () -> CompletableFuture.supplyAsync(() -> {
            try {
                return action.run();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor), executor);
    }

    public static CompletableFuture<Attempt<Void>> attemptOn(IoTask task, Executor executor) {
        return attemptOn(null, () -> {
            task.run();
            return null;
        }, executor);
    }

    private static <T> CompletableFuture<Attempt<T>> attemptAsync(
            T fallback, Supplier<? extends CompletionStage<T>> action, Executor executor, int attemptNo) {
        CompletionStage<T> stage;
        try {
            stage = action.get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        return stage.<CompletableFuture<Attempt<T>>>handle((value, err) -> {
            if (err == null) {
                return CompletableFuture.completedFuture(Attempt.success(value));
            }
            Throwable cause = IoErrorCode.unwrap(err);
            IoErrorCode code = IoErrorCode.classify(cause);
            if (!code.isTransient() || attemptNo + 1 >= MAX_ATTEMPTS) {
                return CompletableFuture.completedFuture(Attempt.failure(fallback, cause));
            }

            long delay = backoffMillis();
            logger.debug("Transient {} ({}), retrying in {} ms", code.symbol(), cause.getMessage(), delay);
            Executor delayed = CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor);
            return CompletableFuture.runAsync(() -> {}, delayed)
                    .thenCompose(ignored -> attemptAsync(fallback, action, executor, attemptNo + 1));
        }).thenCompose(f -> f).toCompletableFuture();
    }

    static long backoffMillis() {
        return ThreadLocalRandom.current().nextLong(MIN_BACKOFF_MS, MAX_BACKOFF_MS + 1);
    }
}
