package notifier.dispatch;

import notifier.Channel;
import notifier.delivery.DeliveryException;
import notifier.delivery.DeliveryProvider;
import notifier.delivery.FailureKind;
import notifier.delivery.OutboundMessage;
import notifier.delivery.SendReceipt;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingProvider implements DeliveryProvider<OutboundMessage> {
  private final String name;
  private final Channel channel;
  private final boolean failing;
  final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();

  RecordingProvider(String name, Channel channel, boolean failing) {
    this.name = name;
    this.channel = channel;
    this.failing = failing;
  }

  static RecordingProvider ok(Channel channel) {
    return new RecordingProvider(channel.code() + "-ok", channel, false);
  }

  static RecordingProvider failing(Channel channel) {
    return new RecordingProvider(channel.code() + "-down", channel, true);
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
  public SendReceipt send(OutboundMessage message) throws DeliveryException {
    sent.add(message);
    if (failing) {
      throw new DeliveryException(FailureKind.TRANSPORT, name + " unavailable");
    }
    return new SendReceipt(name + "-" + sent.size());
  }
}
