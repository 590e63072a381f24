package notifier.delivery;

import notifier.Channel;

/**
 * Adapter around one concrete delivery transport (an SMTP relay, a chat API, ...).
 *
 * <p>A provider makes exactly one attempt per {@link #send} call and never retries
 * internally; retries and failover belong to {@link ProviderFailover}. Timeouts are the
 * provider's responsibility and surface as {@link FailureKind#TIMEOUT}.
 *
 * @param <M> the message type this provider accepts
 */
public interface DeliveryProvider<M extends OutboundMessage> {

  /** Unique provider name, recorded in delivery outcomes. */
  String name();

  Channel channel();

  /**
   * Sends one message.
   *
   * @param message the message
   * @return the provider's receipt
   * @throws DeliveryException if the transport rejected or could not accept the message
   */
  SendReceipt send(M message) throws DeliveryException;
}
