package notifier.delivery;

import notifier.Channel;

import java.util.Objects;

/**
 * @param target    chat channel or user id
 * @param text      message text
 * @param workspace workspace the target belongs to, or {@code null} for the default workspace
 */
public record ChatMessage(String target, String text, String workspace) implements OutboundMessage {

  public ChatMessage {
    Objects.requireNonNull(target, "target");
    text = text == null ? "" : text;
  }

  @Override
  public Channel channel() {
    return Channel.CHAT;
  }

  @Override
  public String destination() {
    return target;
  }
}
