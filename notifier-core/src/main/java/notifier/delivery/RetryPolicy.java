package notifier.delivery;

/**
 * Strategy for computing the pause between failover rounds.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds after a failed round.
   *
   * @param attempts the number of completed rounds (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
