package com.questrail.consolelink.protocol.smartglass;

import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Assertions over already-completed futures. Nothing here blocks.
 */
public final class FutureAssertions {

    private FutureAssertions() {
    }

    public static <T> T valueOf(CompletableFuture<T> future) {
        assertTrue(future.isDone(), "future should be complete");
        assertFalse(future.isCompletedExceptionally(), "future should have succeeded");
        return future.join();
    }

    /**
     * The unwrapped failure of a completed future.
     */
    public static Throwable failureOf(CompletableFuture<?> future) {
        assertTrue(future.isDone(), "future should be complete");
        assertTrue(future.isCompletedExceptionally(), "future should have failed");
        try {
            future.join();
        } catch (CompletionException | CancellationException e) {
            return Futures.unwrap(e);
        }
        return fail("join should have thrown");
    }

    public static <X extends Throwable> X assertFailsWith(Class<X> type, CompletableFuture<?> future) {
        return assertInstanceOf(type, failureOf(future));
    }
}
