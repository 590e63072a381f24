package notifier.delivery;

/**
 * Result of {@link ProviderFailover#sendWithFailover}.
 *
 * @param success   whether some provider accepted the message
 * @param provider  the accepting provider, or the last one tried on failure (may be null)
 * @param messageId provider message id on success
 * @param sends     number of {@code send} calls made
 * @param error     the failure on unsuccessful attempts, otherwise null
 */
public record DeliveryAttempt(boolean success, String provider, String messageId, int sends,
    DeliveryException error) {

  static DeliveryAttempt delivered(String provider, String messageId, int sends) {
    return new DeliveryAttempt(true, provider, messageId, sends, null);
  }

  static DeliveryAttempt failed(String provider, int sends, DeliveryException error) {
    return new DeliveryAttempt(false, provider, null, sends, error);
  }

  public String errorMessage() {
    return error == null ? null : error.getMessage();
  }
}
