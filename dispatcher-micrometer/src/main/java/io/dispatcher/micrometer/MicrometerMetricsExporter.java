package io.dispatcher.micrometer;

import io.dispatcher.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and distribution summaries with a {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dispatcher.dispatch.success}: dispatches with no handler failure</li>
 *   <li>{@code dispatcher.dispatch.failure}: dispatches with at least one handler failure</li>
 *   <li>{@code dispatcher.handler.invocations}: handler calls</li>
 *   <li>{@code dispatcher.handler.failure}: handler calls that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dispatcher.subscriptions.active}: live subscriptions, read from the bound
 *       source each time the gauge is sampled</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code dispatcher.dispatch.duration.ms}: wall time of each dispatch</li>
 *   <li>{@code dispatcher.handler.duration.ms}: time spent in each handler</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter handlerInvocations;
  private final Counter handlerFailure;
  private final Gauge subscriptionsGauge;
  private final DistributionSummary dispatchDuration;
  private final DistributionSummary handlerDuration;

  private final AtomicReference<IntSupplier> subscriptions = new AtomicReference<>(() -> 0);
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dispatcher"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dispatcher");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * dispatchers against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.dispatcher"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Dispatches where every handler succeeded")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Dispatches with at least one failed handler")
        .register(registry);
    this.handlerInvocations = Counter.builder(namePrefix + ".handler.invocations")
        .description("Handler invocations")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Handler invocations that threw")
        .register(registry);

    this.subscriptionsGauge = Gauge.builder(namePrefix + ".subscriptions.active", subscriptions,
            source -> source.get().getAsInt())
        .description("Live subscriptions")
        .register(registry);

    this.dispatchDuration = DistributionSummary.builder(namePrefix + ".dispatch.duration.ms")
        .description("Dispatch wall time in milliseconds")
        .baseUnit("milliseconds")
        .register(registry);
    this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
        .description("Handler execution time in milliseconds")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementHandlerInvocation() {
    if (closed) return;
    handlerInvocations.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void bindSubscriptionCount(IntSupplier count) {
    Objects.requireNonNull(count, "count");
    if (closed) return;
    subscriptions.set(count);
  }

  @Override
  public void recordDispatchDurationMs(long durationMs) {
    if (closed) return;
    dispatchDuration.record(durationMs);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the dispatcher is discarded to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatchSuccess, dispatchFailure, handlerInvocations,
        handlerFailure, subscriptionsGauge, dispatchDuration, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
