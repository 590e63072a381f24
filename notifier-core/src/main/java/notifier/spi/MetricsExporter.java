package notifier.spi;

/**
 * Observability hook for exporting scheduler and dispatch counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of schedules that created a job.
   */
  void incrementScheduleFired();

  /**
   * Increments the count of due schedules skipped because of their concurrency cap.
   */
  void incrementScheduleSkipped();

  /**
   * Increments the count of fires whose job creation failed.
   */
  void incrementScheduleFailed();

  /**
   * Increments the count of successful deliveries (one per recipient and channel).
   */
  void incrementDeliverySuccess();

  /**
   * Increments the count of failed deliveries (one per recipient and channel).
   */
  void incrementDeliveryFailure();

  /**
   * Increments the count of requests queued for batching.
   */
  default void incrementDispatchBatched() {
  }

  /**
   * Increments the count of requests deferred to their {@code scheduledFor} time.
   */
  default void incrementDispatchDeferred() {
  }

  /**
   * Increments the count of requests whose recipients were all filtered out.
   */
  default void incrementNoEligibleRecipients() {
  }

  /**
   * Increments the count of deliveries that succeeded only after the first provider failed.
   */
  default void incrementFailover() {
  }

  /**
   * Records the number of requests waiting in the batch aggregator.
   *
   * @param pending pending entries across all batch keys
   */
  default void recordBatchPending(int pending) {
  }

  /**
   * Records the wall time of one dispatch.
   *
   * @param durationMs dispatch duration in milliseconds (always non-negative)
   */
  default void recordDispatchDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementScheduleFired() {
    }

    @Override
    public void incrementScheduleSkipped() {
    }

    @Override
    public void incrementScheduleFailed() {
    }

    @Override
    public void incrementDeliverySuccess() {
    }

    @Override
    public void incrementDeliveryFailure() {
    }
  }
}
