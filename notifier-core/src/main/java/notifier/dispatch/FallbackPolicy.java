package notifier.dispatch;

import notifier.Channel;
import notifier.DispatchRequest;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides where a request goes when recipient filtering leaves nobody.
 */
@FunctionalInterface
public interface FallbackPolicy {

  /** No fallback: the dispatch ends with "No eligible recipients". */
  FallbackPolicy NONE = request -> Optional.empty();

  /**
   * @return the single destination to deliver to instead, or empty to give up
   */
  Optional<Target> fallbackFor(DispatchRequest request);

  /**
   * A fallback destination.
   *
   * @param channel channel to deliver on
   * @param address address on that channel
   */
  record Target(Channel channel, String address) {
    public Target {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(address, "address");
    }
  }
}
