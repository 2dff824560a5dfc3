package com.questrail.consolelink.protocol.smartglass.internal.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * OrderedRelease
 * -----------------------------------------------------------------------------
 * Teardown as a sequence of independent release steps.
 *
 * <p>Steps run in the order they were added. Each step is isolated: a failure
 * is handed to the failure handler and the remaining steps still run. Nothing
 * is rethrown.</p>
 */
public final class OrderedRelease {

    /**
     * A release step that may fail.
     */
    @FunctionalInterface
    public interface Step {
        void release() throws Exception;
    }

    private record Named(String resource, Step step) {}

    private final List<Named> steps = new ArrayList<>();
    private final BiConsumer<String, Exception> failureHandler;

    /**
     * @param failureHandler receives the resource name and failure of every step that throws
     */
    public OrderedRelease(BiConsumer<String, Exception> failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public OrderedRelease then(String resource, Step step) {
        steps.add(new Named(Objects.requireNonNull(resource, "resource"), Objects.requireNonNull(step, "step")));
        return this;
    }

    /**
     * Run every step in order.
     *
     * @return number of steps that failed
     */
    public int releaseAll() {
        int failures = 0;
        for (Named named : steps) {
            try {
                named.step().release();
            } catch (Exception e) {
                failures++;
                failureHandler.accept(named.resource(), e);
            }
        }
        return failures;
    }
}
