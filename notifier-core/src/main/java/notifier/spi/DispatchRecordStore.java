package notifier.spi;

import notifier.DeliveryOutcome;
import notifier.DispatchRequest;

import java.util.List;

/**
 * Records the outcome of each dispatch for auditing.
 *
 * <p>Called off the dispatch thread; a failure here never changes a dispatch result.
 */
@FunctionalInterface
public interface DispatchRecordStore {

  /** Store that records nothing. */
  DispatchRecordStore NONE = (dispatchId, request, outcomes) -> { };

  void saveDispatchResult(String dispatchId, DispatchRequest request, List<DeliveryOutcome> outcomes);
}
