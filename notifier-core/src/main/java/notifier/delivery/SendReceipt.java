package notifier.delivery;

/**
 * Acknowledgement returned by a provider that accepted a message.
 *
 * @param messageId provider-assigned message id, may be null
 */
public record SendReceipt(String messageId) {
}
