package notifier.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import notifier.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code notifier.schedule.fired}: schedules that created a job</li>
 *   <li>{@code notifier.schedule.skipped}: due schedules skipped at their concurrency cap</li>
 *   <li>{@code notifier.schedule.failed}: fires whose job creation failed</li>
 *   <li>{@code notifier.dispatch.success}: successful deliveries</li>
 *   <li>{@code notifier.dispatch.failure}: failed deliveries</li>
 *   <li>{@code notifier.dispatch.batched}: requests queued for a digest</li>
 *   <li>{@code notifier.dispatch.deferred}: requests stored for later delivery</li>
 *   <li>{@code notifier.dispatch.no_eligible}: requests with every recipient filtered out</li>
 *   <li>{@code notifier.delivery.failover}: deliveries that needed more than one send</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code notifier.batch.pending}: requests waiting in the batch aggregator</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code notifier.dispatch.duration}: dispatch wall time in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "notifier";

  private final MeterRegistry registry;
  private final Counter scheduleFired;
  private final Counter scheduleSkipped;
  private final Counter scheduleFailed;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter dispatchBatched;
  private final Counter dispatchDeferred;
  private final Counter noEligible;
  private final Counter failover;
  private final Gauge batchPendingGauge;
  private final DistributionSummary dispatchDuration;

  private final AtomicInteger batchPending = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "notifier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * notifiers against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.notifier"})
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
    this.scheduleFired = Counter.builder(namePrefix + ".schedule.fired")
        .description("Schedules that created a job")
        .register(registry);
    this.scheduleSkipped = Counter.builder(namePrefix + ".schedule.skipped")
        .description("Due schedules skipped at their concurrency cap")
        .register(registry);
    this.scheduleFailed = Counter.builder(namePrefix + ".schedule.failed")
        .description("Schedule fires whose job creation failed")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Successful deliveries, one per recipient and channel")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Failed deliveries, one per recipient and channel")
        .register(registry);
    this.dispatchBatched = Counter.builder(namePrefix + ".dispatch.batched")
        .description("Requests queued for a digest")
        .register(registry);
    this.dispatchDeferred = Counter.builder(namePrefix + ".dispatch.deferred")
        .description("Requests stored for later delivery")
        .register(registry);
    this.noEligible = Counter.builder(namePrefix + ".dispatch.no_eligible")
        .description("Requests whose recipients were all filtered out")
        .register(registry);
    this.failover = Counter.builder(namePrefix + ".delivery.failover")
        .description("Deliveries that succeeded after a provider failed")
        .register(registry);

    this.batchPendingGauge = Gauge.builder(namePrefix + ".batch.pending", batchPending, AtomicInteger::get)
        .description("Requests waiting in the batch aggregator")
        .register(registry);
    this.dispatchDuration = DistributionSummary.builder(namePrefix + ".dispatch.duration")
        .description("Dispatch wall time")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementScheduleFired() {
    if (closed) return;
    scheduleFired.increment();
  }

  @Override
  public void incrementScheduleSkipped() {
    if (closed) return;
    scheduleSkipped.increment();
  }

  @Override
  public void incrementScheduleFailed() {
    if (closed) return;
    scheduleFailed.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDispatchBatched() {
    if (closed) return;
    dispatchBatched.increment();
  }

  @Override
  public void incrementDispatchDeferred() {
    if (closed) return;
    dispatchDeferred.increment();
  }

  @Override
  public void incrementNoEligibleRecipients() {
    if (closed) return;
    noEligible.increment();
  }

  @Override
  public void incrementFailover() {
    if (closed) return;
    failover.increment();
  }

  @Override
  public void recordBatchPending(int pending) {
    if (closed) return;
    batchPending.set(pending);
  }

  @Override
  public void recordDispatchDurationMs(long durationMs) {
    if (closed) return;
    dispatchDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the dispatch engine and scheduler are shut down to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(scheduleFired, scheduleSkipped, scheduleFailed,
        deliverySuccess, deliveryFailure, dispatchBatched, dispatchDeferred, noEligible, failover,
        batchPendingGauge, dispatchDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
