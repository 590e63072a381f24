package notifier;

/**
 * How a recipient prefers to receive non-critical notifications.
 */
public enum DeliveryFrequency {
  /** Deliver as soon as the request is dispatched. */
  IMMEDIATE,
  /** Queue and combine with similar requests, delivered on the batch flush interval. */
  BATCHED,
  /** Left to the external digest pipeline; treated like {@link #IMMEDIATE} by the engine. */
  DIGEST
}
