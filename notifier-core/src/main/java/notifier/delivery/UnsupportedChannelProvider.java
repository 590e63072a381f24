package notifier.delivery;

import notifier.Channel;

import java.util.Locale;
import java.util.Objects;

/**
 * Provider for a channel that has no transport; every send fails with
 * {@link FailureKind#NOT_CONFIGURED}.
 */
public final class UnsupportedChannelProvider implements DeliveryProvider<OutboundMessage> {
  private final Channel channel;

  public UnsupportedChannelProvider(Channel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public String name() {
    return channel.code() + "-unsupported";
  }

  @Override
  public Channel channel() {
    return channel;
  }

  @Override
  public SendReceipt send(OutboundMessage message) throws DeliveryException {
    throw new DeliveryException(FailureKind.NOT_CONFIGURED,
        channel.code().toUpperCase(Locale.ROOT) + " notifications not implemented");
  }
}
