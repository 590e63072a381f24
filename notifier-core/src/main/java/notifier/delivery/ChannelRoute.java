package notifier.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry settings for one channel.
 *
 * @param maxRetries number of full rounds over the channel's providers (&ge; 1)
 * @param baseDelay  pause after the first failed round
 * @param maxDelay   cap on the pause between rounds
 */
public record ChannelRoute(int maxRetries, Duration baseDelay, Duration maxDelay) {

  public static final ChannelRoute DEFAULT = new ChannelRoute(3, Duration.ofSeconds(1), Duration.ofSeconds(30));

  public ChannelRoute {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
    }
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must be >= 0");
    }
  }

  public RetryPolicy retryPolicy() {
    return new ExponentialBackoffRetryPolicy(baseDelay.toMillis(), maxDelay.toMillis());
  }
}
