package notifier;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of one {@link notifier.dispatch.DispatchEngine#dispatch dispatch} call.
 *
 * <p>{@link #success()} is {@code true} iff at least one delivery succeeded, or the request
 * was accepted for later delivery (batched or deferred). A successful result with a non-null
 * {@link #error()} signals partial failure; callers should compare
 * {@link #successful()} and {@link #failed()} rather than parse the error string.
 */
public final class DispatchResult {

  /** What the engine did with the request. */
  public enum Disposition {
    /** Delivered (or attempted) immediately. */
    DELIVERED,
    /** Queued in the batch aggregator. */
    BATCHED,
    /** Persisted for delivery at {@code scheduledFor}. */
    DEFERRED,
    /** Filtering removed every recipient and no fallback delivered it. */
    NO_ELIGIBLE_RECIPIENTS,
    /** {@code expiresAt} had passed; nothing was sent. */
    EXPIRED
  }

  private final String dispatchId;
  private final Disposition disposition;
  private final List<DeliveryOutcome> outcomes;
  private final int totalRecipients;
  private final int successful;
  private final int failed;
  private final boolean success;
  private final String error;
  private final Duration duration;

  private DispatchResult(String dispatchId, Disposition disposition, List<DeliveryOutcome> outcomes,
      int totalRecipients, boolean acceptedForLater, String error, Duration duration) {
    this.dispatchId = Objects.requireNonNull(dispatchId, "dispatchId");
    this.disposition = Objects.requireNonNull(disposition, "disposition");
    this.outcomes = List.copyOf(outcomes);
    this.totalRecipients = totalRecipients;
    int ok = 0;
    for (DeliveryOutcome outcome : this.outcomes) {
      if (outcome.success()) {
        ok++;
      }
    }
    this.successful = ok;
    this.failed = this.outcomes.size() - ok;
    this.success = acceptedForLater || ok > 0;
    this.error = error;
    this.duration = duration == null ? Duration.ZERO : duration;
  }

  /**
   * Result of an immediate delivery. Carries {@code "<n> deliveries failed"} when any failed.
   */
  public static DispatchResult delivered(String dispatchId, int totalRecipients,
      List<DeliveryOutcome> outcomes, Duration duration) {
    long failures = outcomes.stream().filter(o -> !o.success()).count();
    String error = failures > 0 ? failures + " deliveries failed" : null;
    return new DispatchResult(dispatchId, Disposition.DELIVERED, outcomes, totalRecipients,
        false, error, duration);
  }

  public static DispatchResult batched(String dispatchId, int totalRecipients, Duration duration) {
    return new DispatchResult(dispatchId, Disposition.BATCHED, List.of(), totalRecipients,
        true, null, duration);
  }

  public static DispatchResult deferred(String dispatchId, int totalRecipients, Duration duration) {
    return new DispatchResult(dispatchId, Disposition.DEFERRED, List.of(), totalRecipients,
        true, null, duration);
  }

  public static DispatchResult noEligibleRecipients(String dispatchId, Duration duration) {
    return new DispatchResult(dispatchId, Disposition.NO_ELIGIBLE_RECIPIENTS, List.of(), 0,
        false, "No eligible recipients", duration);
  }

  public static DispatchResult expired(String dispatchId, Duration duration) {
    return new DispatchResult(dispatchId, Disposition.EXPIRED, List.of(), 0,
        false, "Request expired before dispatch", duration);
  }

  public String dispatchId() {
    return dispatchId;
  }

  public Disposition disposition() {
    return disposition;
  }

  public List<DeliveryOutcome> outcomes() {
    return outcomes;
  }

  public int totalRecipients() {
    return totalRecipients;
  }

  public int successful() {
    return successful;
  }

  public int failed() {
    return failed;
  }

  public boolean success() {
    return success;
  }

  public boolean isPartialFailure() {
    return successful > 0 && failed > 0;
  }

  /** Error summary, or {@code null} when nothing failed. */
  public String error() {
    return error;
  }

  public Duration duration() {
    return duration;
  }

  @Override
  public String toString() {
    return "DispatchResult{id=" + dispatchId + ", disposition=" + disposition
        + ", successful=" + successful + ", failed=" + failed + ", success=" + success + "}";
  }
}
