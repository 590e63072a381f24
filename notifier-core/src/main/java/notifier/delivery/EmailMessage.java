package notifier.delivery;

import notifier.Channel;

import java.util.Objects;

/**
 * @param to      recipient address
 * @param subject subject line
 * @param text    plain-text body
 * @param html    HTML body, or {@code null}
 */
public record EmailMessage(String to, String subject, String text, String html) implements OutboundMessage {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    subject = subject == null ? "" : subject;
    text = text == null ? "" : text;
  }

  @Override
  public Channel channel() {
    return Channel.EMAIL;
  }

  @Override
  public String destination() {
    return to;
  }
}
