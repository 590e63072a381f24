package notifier.delivery;

import notifier.Channel;

/**
 * Every provider of a channel failed on every attempt. Carries the last error as its cause.
 */
public class AllProvidersFailedException extends DeliveryException {
  private final int sends;

  public AllProvidersFailedException(Channel channel, int sends, DeliveryException lastError) {
    super(lastError == null ? FailureKind.NOT_CONFIGURED : lastError.kind(),
        "All " + channel.code() + " providers failed. Last error: "
            + (lastError == null ? "no providers registered" : lastError.getMessage()),
        lastError);
    this.sends = sends;
  }

  /** Number of {@code send} calls made before giving up. */
  public int sends() {
    return sends;
  }
}
