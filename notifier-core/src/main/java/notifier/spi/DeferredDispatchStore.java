package notifier.spi;

import notifier.DispatchRequest;
import notifier.Recipient;

import java.time.Instant;
import java.util.List;

/**
 * Persists requests whose {@code scheduledFor} lies in the future.
 *
 * <p>An external poller resubmits them to the dispatch engine when due, with
 * {@code scheduledFor} left as stored so that delay rules do not defer them again.
 */
@FunctionalInterface
public interface DeferredDispatchStore {

  void saveScheduled(DispatchRequest request, List<Recipient> recipients, Instant scheduledFor);
}
