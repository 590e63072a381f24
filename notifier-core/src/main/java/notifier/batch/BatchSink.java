package notifier.batch;

import notifier.DispatchRequest;
import notifier.DispatchResult;

/**
 * Receives digest requests produced by a {@link BatchAggregator} flush.
 */
@FunctionalInterface
public interface BatchSink {

  /**
   * Delivers a digest whose recipients were already filtered.
   *
   * @throws RuntimeException to keep the batch queued for the next flush
   */
  DispatchResult deliver(DispatchRequest digest);
}
