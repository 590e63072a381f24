package notifier.dispatch;

import notifier.Channel;
import notifier.DispatchRequest;

import java.util.Objects;
import java.util.Optional;

/**
 * Sends requests without eligible recipients to one shared chat channel, such as an
 * operations channel. Requests restricted to other channels are not redirected.
 */
public final class DefaultChannelFallback implements FallbackPolicy {
  private final String chatChannel;

  public DefaultChannelFallback(String chatChannel) {
    this.chatChannel = Objects.requireNonNull(chatChannel, "chatChannel");
    if (chatChannel.isBlank()) {
      throw new IllegalArgumentException("chatChannel cannot be blank");
    }
  }

  @Override
  public Optional<Target> fallbackFor(DispatchRequest request) {
    if (!request.allowsChannel(Channel.CHAT)) {
      return Optional.empty();
    }
    return Optional.of(new Target(Channel.CHAT, chatChannel));
  }

  public String chatChannel() {
    return chatChannel;
  }
}
