package notifier.delivery;

import notifier.Channel;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-channel {@link ChannelRoute retry settings}, falling back to a default route.
 */
public final class ChannelRoutes {
  private final ChannelRoute defaultRoute;
  private final Map<Channel, ChannelRoute> overrides;

  private ChannelRoutes(ChannelRoute defaultRoute, Map<Channel, ChannelRoute> overrides) {
    this.defaultRoute = defaultRoute;
    this.overrides = overrides;
  }

  public static ChannelRoutes defaults() {
    return new ChannelRoutes(ChannelRoute.DEFAULT, new EnumMap<>(Channel.class));
  }

  public static ChannelRoutes of(ChannelRoute defaultRoute) {
    return new ChannelRoutes(Objects.requireNonNull(defaultRoute, "defaultRoute"), new EnumMap<>(Channel.class));
  }

  /**
   * Returns a copy with {@code route} used for {@code channel}.
   */
  public ChannelRoutes with(Channel channel, ChannelRoute route) {
    Map<Channel, ChannelRoute> copy = new EnumMap<>(Channel.class);
    copy.putAll(overrides);
    copy.put(Objects.requireNonNull(channel, "channel"), Objects.requireNonNull(route, "route"));
    return new ChannelRoutes(defaultRoute, copy);
  }

  public ChannelRoute routeFor(Channel channel) {
    return overrides.getOrDefault(channel, defaultRoute);
  }
}
