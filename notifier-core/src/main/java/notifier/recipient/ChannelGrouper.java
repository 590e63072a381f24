package notifier.recipient;

import notifier.Channel;
import notifier.ChannelPreference;
import notifier.Recipient;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Assigns each recipient to exactly one channel: its highest-priority enabled channel
 * that the request allows. Recipients without such a channel are left out.
 */
public final class ChannelGrouper {

  /**
   * @param recipients     eligible recipients
   * @param allowedChannel which channels the request may use
   * @return recipients per channel, each list in input order
   */
  public Map<Channel, List<Recipient>> group(List<Recipient> recipients, Predicate<Channel> allowedChannel) {
    Map<Channel, List<Recipient>> groups = new EnumMap<>(Channel.class);
    for (Recipient recipient : recipients) {
      Channel channel = selectChannel(recipient, allowedChannel);
      if (channel != null) {
        groups.computeIfAbsent(channel, ignored -> new ArrayList<>()).add(recipient);
      }
    }
    return groups;
  }

  /**
   * @return the chosen channel, or {@code null} when none is enabled and allowed
   */
  public Channel selectChannel(Recipient recipient, Predicate<Channel> allowedChannel) {
    for (ChannelPreference pref : recipient.preferences().enabledChannelsByPriority()) {
      if (allowedChannel.test(pref.channel())) {
        return pref.channel();
      }
    }
    return null;
  }
}
