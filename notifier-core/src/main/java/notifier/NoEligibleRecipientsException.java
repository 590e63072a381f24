package notifier;

/**
 * Signals that recipient filtering removed every recipient of a request.
 *
 * <p>This is recoverable: callers typically apply a fallback (such as a default chat
 * channel) instead of treating it as a transport failure.
 */
public class NoEligibleRecipientsException extends NotifierException {
  private final String dispatchId;
  private final int originalCount;

  public NoEligibleRecipientsException(String dispatchId, int originalCount) {
    super("No eligible recipients for dispatch " + dispatchId + " (" + originalCount + " filtered out)");
    this.dispatchId = dispatchId;
    this.originalCount = originalCount;
  }

  public String dispatchId() {
    return dispatchId;
  }

  public int originalCount() {
    return originalCount;
  }
}
