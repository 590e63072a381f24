package notifier;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of delivering one request to one recipient on one channel.
 *
 * @param channel   the channel used
 * @param recipient the recipient address (or a {@code user_<id>} placeholder when none was known)
 * @param success   whether a provider accepted the message
 * @param provider  name of the provider that accepted it, or of the last provider tried; may be null
 * @param messageId provider message id on success, otherwise null
 * @param error     error description on failure, otherwise null
 * @param timestamp when the outcome was recorded
 */
public record DeliveryOutcome(
    Channel channel,
    String recipient,
    boolean success,
    String provider,
    String messageId,
    String error,
    Instant timestamp) {

  public DeliveryOutcome {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static DeliveryOutcome delivered(Channel channel, String recipient, String provider,
      String messageId, Instant timestamp) {
    return new DeliveryOutcome(channel, recipient, true, provider, messageId, null, timestamp);
  }

  public static DeliveryOutcome failed(Channel channel, String recipient, String provider,
      String error, Instant timestamp) {
    return new DeliveryOutcome(channel, recipient, false, provider, null,
        error == null ? "Unknown error" : error, timestamp);
  }
}
