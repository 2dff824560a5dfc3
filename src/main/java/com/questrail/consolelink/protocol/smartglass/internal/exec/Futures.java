package com.questrail.consolelink.protocol.smartglass.internal.exec;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Small helpers shared by the asynchronous call sites.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} wrappers
     * added by {@link CompletableFuture} stages.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static <T> CompletableFuture<T> failed(Throwable failure) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(failure);
        return future;
    }
}
