package notifier.delivery;

import notifier.Channel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of delivery providers, grouped by channel.
 *
 * <p>Providers of a channel are tried in registration order. Lookups return snapshots,
 * so registrations made while a delivery is in progress take effect on the next one.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ProviderRegistry providers = new ProviderRegistry()
 *     .register(primarySmtp)
 *     .register(backupSmtp)
 *     .register(new UnsupportedChannelProvider(Channel.SMS));
 * }</pre>
 */
public final class ProviderRegistry {
  private final Map<Channel, CopyOnWriteArrayList<DeliveryProvider<?>>> providers = new ConcurrentHashMap<>();

  /**
   * Registers a provider under its {@link DeliveryProvider#channel() channel}. The
   * provider must accept that channel's message type.
   *
   * @throws IllegalArgumentException if a provider with the same name is already registered
   *                                  for the channel
   */
  public ProviderRegistry register(DeliveryProvider<?> provider) {
    CopyOnWriteArrayList<DeliveryProvider<?>> list =
        providers.computeIfAbsent(provider.channel(), ignored -> new CopyOnWriteArrayList<>());
    synchronized (list) {
      for (DeliveryProvider<?> existing : list) {
        if (existing.name().equals(provider.name())) {
          throw new IllegalArgumentException("Provider '" + provider.name() + "' already registered for "
              + provider.channel());
        }
      }
      list.add(provider);
    }
    return this;
  }

  public boolean unregister(Channel channel, String name) {
    CopyOnWriteArrayList<DeliveryProvider<?>> list = providers.get(channel);
    return list != null && list.removeIf(p -> p.name().equals(name));
  }

  /**
   * Returns the providers registered for {@code channel}, in registration order.
   */
  @SuppressWarnings("unchecked")
  public <M extends OutboundMessage> List<DeliveryProvider<M>> providersFor(Channel channel) {
    CopyOnWriteArrayList<DeliveryProvider<?>> list = providers.get(channel);
    if (list == null) {
      return List.of();
    }
    List<DeliveryProvider<M>> result = new ArrayList<>(list.size());
    for (DeliveryProvider<?> provider : list) {
      result.add((DeliveryProvider<M>) provider);
    }
    return Collections.unmodifiableList(result);
  }

  public Set<Channel> channels() {
    Set<Channel> result = EnumSet.noneOf(Channel.class);
    providers.forEach((channel, list) -> {
      if (!list.isEmpty()) {
        result.add(channel);
      }
    });
    return result;
  }
}
