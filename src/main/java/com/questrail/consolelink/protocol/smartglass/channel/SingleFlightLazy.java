package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * SingleFlightLazy
 * -----------------------------------------------------------------------------
 * An asynchronously created resource opened at most once.
 *
 * <p>The first {@link #get()} starts the factory; every caller, concurrent or
 * later, receives the outcome of that single open, including its failure.
 * No lock is held while the open is in flight.</p>
 *
 * <p>{@link #close()} closes the value if one was realized. A value still
 * being opened is closed as soon as it arrives. After close, {@link #get()}
 * fails with {@link IllegalStateException}.</p>
 */
public final class SingleFlightLazy<T extends AutoCloseable> implements AutoCloseable {

    private final Supplier<CompletableFuture<T>> factory;
    private final BiConsumer<String, Throwable> lateCloseFailureHandler;
    private final AtomicReference<CompletableFuture<T>> current = new AtomicReference<>();
    private final CompletableFuture<T> closedMarker;

    /**
     * @param factory                 opens the value; invoked at most once
     * @param lateCloseFailureHandler receives failures closing a value that was
     *                                still in flight when this lazy was closed
     */
    public SingleFlightLazy(Supplier<CompletableFuture<T>> factory,
                            BiConsumer<String, Throwable> lateCloseFailureHandler) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.lateCloseFailureHandler = Objects.requireNonNull(lateCloseFailureHandler, "lateCloseFailureHandler");
        this.closedMarker = Futures.failed(new IllegalStateException("already closed"));
    }

    public CompletableFuture<T> get() {
        CompletableFuture<T> existing = current.get();
        if (existing != null) {
            return existing.copy();
        }

        CompletableFuture<T> fresh = new CompletableFuture<>();
        if (!current.compareAndSet(null, fresh)) {
            return current.get().copy();
        }

        try {
            factory.get().whenComplete((value, failure) -> {
                if (failure != null) {
                    fresh.completeExceptionally(Futures.unwrap(failure));
                } else {
                    fresh.complete(value);
                }
            });
        } catch (RuntimeException e) {
            fresh.completeExceptionally(e);
        }
        return fresh.copy();
    }

    /**
     * @return {@code true} once an open has been started
     */
    public boolean isStarted() {
        CompletableFuture<T> existing = current.get();
        return existing != null && existing != closedMarker;
    }

    /**
     * Close the realized value, if any. Idempotent.
     *
     * @throws ConsoleLinkException if closing an already realized value fails
     */
    @Override
    public void close() {
        CompletableFuture<T> previous = current.getAndSet(closedMarker);
        if (previous == null || previous == closedMarker) {
            return;
        }

        if (previous.isDone()) {
            if (previous.isCompletedExceptionally()) {
                return;
            }
            closeValue(previous.join());
            return;
        }

        previous.whenComplete((value, failure) -> {
            if (failure != null) {
                return;
            }
            try {
                value.close();
            } catch (Exception e) {
                lateCloseFailureHandler.accept(value.getClass().getSimpleName(), e);
            }
        });
    }

    private void closeValue(T value) {
        try {
            value.close();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ConsoleLinkException("Failed to close " + value.getClass().getSimpleName(), e);
        }
    }
}
