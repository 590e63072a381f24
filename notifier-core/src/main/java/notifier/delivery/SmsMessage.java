package notifier.delivery;

import notifier.Channel;

import java.util.Objects;

/**
 * @param phoneNumber recipient phone number
 * @param text        message text
 */
public record SmsMessage(String phoneNumber, String text) implements OutboundMessage {

  public SmsMessage {
    Objects.requireNonNull(phoneNumber, "phoneNumber");
    text = text == null ? "" : text;
  }

  @Override
  public Channel channel() {
    return Channel.SMS;
  }

  @Override
  public String destination() {
    return phoneNumber;
  }
}
