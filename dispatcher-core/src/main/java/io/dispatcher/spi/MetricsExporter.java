package io.dispatcher.spi;

import java.util.function.IntSupplier;

/**
 * Observability hook for exporting dispatcher counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implementations are called on the
 * dispatching thread and must not block.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Counts a dispatch whose notification ended in {@code SUCCESS}.
     */
    void incrementDispatchSuccess();

    /**
     * Counts a dispatch whose notification ended in {@code FAILURE}.
     */
    void incrementDispatchFailure();

    /**
     * Counts one handler invocation, successful or not.
     */
    default void incrementHandlerInvocation() {
    }

    /**
     * Counts one handler that threw during dispatch.
     */
    void incrementHandlerFailure();

    /**
     * Binds the source of the live subscription count. The dispatcher calls this once at
     * construction; implementations read the supplier whenever they sample the count.
     *
     * @param count reads the current subscription count
     */
    void bindSubscriptionCount(IntSupplier count);

    /**
     * Records wall time of a whole dispatch call.
     *
     * @param durationMs elapsed milliseconds (always non-negative)
     */
    default void recordDispatchDurationMs(long durationMs) {
    }

    /**
     * Records the time spent inside a single handler.
     *
     * @param durationMs elapsed milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void bindSubscriptionCount(IntSupplier count) {
        }
    }
}
