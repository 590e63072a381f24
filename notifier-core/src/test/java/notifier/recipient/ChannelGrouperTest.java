package notifier.recipient;

import notifier.Channel;
import notifier.ChannelPreference;
import notifier.Recipient;
import notifier.RecipientPreferences;
import notifier.TestRecipients;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelGrouperTest {

  private final ChannelGrouper grouper = new ChannelGrouper();

  private static Recipient ranked(String id, ChannelPreference... prefs) {
    return TestRecipients.withPreferences(id, RecipientPreferences.builder()
        .allCategories()
        .channels(List.of(prefs))
        .build());
  }

  @Test
  void picksHighestPriorityEnabledAllowedChannel() {
    Recipient recipient = ranked("u1",
        ChannelPreference.enabled(Channel.EMAIL, 1),
        ChannelPreference.disabled(Channel.WEBHOOK),
        ChannelPreference.enabled(Channel.CHAT, 5));

    Map<Channel, List<Recipient>> groups = grouper.group(List.of(recipient), channel -> true);

    assertEquals(Map.of(Channel.CHAT, List.of(recipient)), groups);
  }

  @Test
  void fallsBackToNextChannelWhenPreferredIsNotAllowed() {
    Recipient recipient = ranked("u1",
        ChannelPreference.enabled(Channel.EMAIL, 1),
        ChannelPreference.enabled(Channel.CHAT, 5));
    Set<Channel> allowed = EnumSet.of(Channel.EMAIL);

    assertEquals(Channel.EMAIL, grouper.selectChannel(recipient, allowed::contains));
  }

  @Test
  void recipientWithNoAllowedChannelIsLeftOut() {
    Recipient recipient = ranked("u1", ChannelPreference.enabled(Channel.EMAIL, 1));

    assertNull(grouper.selectChannel(recipient, channel -> channel == Channel.SMS));
    assertTrue(grouper.group(List.of(recipient), channel -> channel == Channel.SMS).isEmpty());
  }

  @Test
  void eachRecipientLandsInExactlyOneGroup() {
    Recipient a = TestRecipients.emailUser("a");
    Recipient b = TestRecipients.chatUser("b");
    Recipient c = TestRecipients.emailUser("c");

    Map<Channel, List<Recipient>> groups = grouper.group(List.of(a, b, c), channel -> true);

    assertEquals(List.of(a, c), groups.get(Channel.EMAIL));
    assertEquals(List.of(b), groups.get(Channel.CHAT));
    assertEquals(2, groups.size());
  }

  @Test
  void equalPriorityKeepsDeclarationOrder() {
    Recipient recipient = ranked("u1",
        ChannelPreference.enabled(Channel.WEBHOOK, 3),
        ChannelPreference.enabled(Channel.EMAIL, 3));

    assertEquals(Channel.WEBHOOK, grouper.selectChannel(recipient, channel -> true));
  }
}
