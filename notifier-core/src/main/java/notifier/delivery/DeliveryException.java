package notifier.delivery;

import java.util.Objects;

/**
 * Thrown by a {@link DeliveryProvider} that could not hand a message to its transport.
 */
public class DeliveryException extends Exception {
  private final FailureKind kind;

  public DeliveryException(FailureKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DeliveryException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public FailureKind kind() {
    return kind;
  }
}
