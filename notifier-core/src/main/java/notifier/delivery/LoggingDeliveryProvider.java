package notifier.delivery;

import com.github.f4b6a3.ulid.UlidCreator;
import notifier.Channel;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Provider that logs each message and reports success. Useful during development and as
 * the last provider of a channel whose real transport is not wired yet.
 *
 * @param <M> the message type
 */
public final class LoggingDeliveryProvider<M extends OutboundMessage> implements DeliveryProvider<M> {
  private static final Logger logger = Logger.getLogger(LoggingDeliveryProvider.class.getName());

  private final String name;
  private final Channel channel;
  private final AtomicLong sent = new AtomicLong();

  public LoggingDeliveryProvider(String name, Channel channel) {
    this.name = Objects.requireNonNull(name, "name");
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public SendReceipt send(M message) {
    String messageId = UlidCreator.getMonotonicUlid().toString();
    logger.log(Level.INFO, "[{0}] {1} message to {2}: {3}",
        new Object[] {name, channel.code(), message.destination(), message});
    sent.incrementAndGet();
    return new SendReceipt(messageId);
  }

  public long sentCount() {
    return sent.get();
  }
}
