package notifier;

/**
 * Recipient factories shared by the dispatch-side tests.
 */
public final class TestRecipients {

  private TestRecipients() {
  }

  /** Opted into every category, email only, immediate delivery. */
  public static Recipient emailUser(String id) {
    return Recipient.builder(id)
        .email(id + "@example.com")
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.enabled(Channel.EMAIL, 10))
            .build())
        .build();
  }

  /** Opted into every category, chat only, immediate delivery. */
  public static Recipient chatUser(String id) {
    return Recipient.builder(id)
        .chat("acme", "U-" + id)
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.enabled(Channel.CHAT, 10))
            .build())
        .build();
  }

  public static Recipient withPreferences(String id, RecipientPreferences preferences) {
    return Recipient.builder(id)
        .email(id + "@example.com")
        .chat("acme", "U-" + id)
        .preferences(preferences)
        .build();
  }
}
