package notifier.delivery;

import notifier.Channel;

/**
 * A composed message ready for a {@link DeliveryProvider}.
 */
public interface OutboundMessage {

  Channel channel();

  /** The address the message goes to: email address, chat user, URL or phone number. */
  String destination();
}
