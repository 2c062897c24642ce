package com.fsnode.app.io;

import org.junit.jupiter.api.Test;

import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingOperationTest {

    @Test
    void transientFailureIsRetriedOnce() {
        AtomicInteger calls = new AtomicInteger();

        Attempt<String> a = RetryingOperation.attempt("fallback", () -> {
            if (calls.incrementAndGet() == 1) throw new NoSuchFileException("late.txt");
            return "ok";
        });

        assertTrue(a.ok());
        assertEquals("ok", a.data());
        assertEquals(2, calls.get());
    }

    @Test
    void nonTransientFailureStopsAtOnce() {
        AtomicInteger calls = new AtomicInteger();

        Attempt<String> a = RetryingOperation.attempt("fallback", () -> {
            calls.incrementAndGet();
            throw new AccessDeniedException("secret.txt");
        });

        assertFalse(a.ok());
        assertEquals("fallback", a.data());
        assertEquals(IoErrorCode.ACCESS_DENIED, a.code());
        assertEquals(1, calls.get());
    }

    @Test
    void neverMoreThanTwoAttempts() {
        AtomicInteger calls = new AtomicInteger();

        Attempt<Void> a = RetryingOperation.attempt(() -> {
            calls.incrementAndGet();
            throw new NoSuchFileException("never.txt");
        });

        assertFalse(a.ok());
        assertEquals(IoErrorCode.NOT_FOUND, a.code());
        assertEquals(RetryingOperation.MAX_ATTEMPTS, calls.get());
    }

    @Test
    void asyncRetryWithoutBlocking() {
        AtomicInteger calls = new AtomicInteger();
        Executor direct = Runnable::run;

        Attempt<String> a = RetryingOperation.attemptAsync("fallback", () -> calls.incrementAndGet() == 1
                ? CompletableFuture.<String>failedFuture(new NoSuchFileException("late.txt"))
                : CompletableFuture.completedFuture("ok"), direct).join();

        assertTrue(a.ok());
        assertEquals("ok", a.data());
        assertEquals(2, calls.get());
    }

    @Test
    void asyncActionThrowingSynchronouslyIsAnAttemptToo() {
        Attempt<Integer> a = RetryingOperation.<Integer>attemptAsync(-1, () -> {
            throw new IllegalStateException("boom");
        }, Runnable::run).join();

        assertFalse(a.ok());
        assertEquals(-1, a.data());
        assertEquals(IoErrorCode.IO, a.code());
    }

    @Test
    void attemptOnRunsTheBlockingActionOnTheExecutor() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor(r -> new Thread(r, "retry-test"));
        try {
            AtomicInteger calls = new AtomicInteger();
            Attempt<String> a = RetryingOperation.attemptOn("none", () -> {
                calls.incrementAndGet();
                throw new AccessDeniedException(Thread.currentThread().getName());
            }, pool).get();

            assertFalse(a.ok());
            assertEquals("none", a.data());
            assertEquals("retry-test", a.error().getMessage(), "Action should run on the given executor");
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void backoffStaysWithinBounds() {
        for (int i = 0; i < 50; i++) {
            long d = RetryingOperation.backoffMillis();
            assertTrue(d >= 100 && d <= 200, "backoff out of range: " + d);
        }
    }
}
