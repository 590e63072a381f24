package notifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One channel a recipient can be reached on, with its rank and channel-specific settings.
 *
 * @param channel  the channel
 * @param enabled  whether the recipient accepts notifications on it
 * @param priority higher values are preferred
 * @param config   channel settings, e.g. {@code url} for webhooks
 */
public record ChannelPreference(Channel channel, boolean enabled, int priority, Map<String, String> config) {

  public static final String WEBHOOK_URL = "url";

  public ChannelPreference {
    Objects.requireNonNull(channel, "channel");
    config = config == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }

  public static ChannelPreference enabled(Channel channel, int priority) {
    return new ChannelPreference(channel, true, priority, null);
  }

  public static ChannelPreference disabled(Channel channel) {
    return new ChannelPreference(channel, false, 0, null);
  }

  public static ChannelPreference webhook(String url, int priority) {
    return new ChannelPreference(Channel.WEBHOOK, true, priority, Map.of(WEBHOOK_URL, url));
  }
}
