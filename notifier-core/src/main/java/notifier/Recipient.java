package notifier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Someone a notification can be delivered to: per-channel addresses plus preferences.
 *
 * <p>Two recipients are equal when their ids are equal.
 */
public final class Recipient {
  private final String id;
  private final Map<Channel, String> addresses;
  private final String chatWorkspace;
  private final RecipientPreferences preferences;

  private Recipient(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    this.addresses = builder.addresses.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new EnumMap<>(builder.addresses));
    this.chatWorkspace = builder.chatWorkspace;
    this.preferences = builder.preferences == null
        ? RecipientPreferences.builder().build()
        : builder.preferences;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String id() {
    return id;
  }

  public RecipientPreferences preferences() {
    return preferences;
  }

  /** Chat workspace the recipient's chat address belongs to, or {@code null}. */
  public String chatWorkspace() {
    return chatWorkspace;
  }

  /**
   * Resolves the recipient's address on a channel.
   *
   * <p>Webhook addresses come from the {@code url} setting of the webhook channel
   * preference when no explicit address is set.
   *
   * @return the address, or {@code null} if the recipient has none for this channel
   */
  public String address(Channel channel) {
    String address = addresses.get(channel);
    if (address == null && channel == Channel.WEBHOOK) {
      address = preferences.channel(Channel.WEBHOOK)
          .map(pref -> pref.config().get(ChannelPreference.WEBHOOK_URL))
          .orElse(null);
    }
    return address;
  }

  /**
   * Address used in delivery outcomes: the real address, or a {@code user_<id>} placeholder.
   */
  public String displayAddress(Channel channel) {
    String address = address(channel);
    return address != null ? address : "user_" + id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Recipient)) return false;
    return id.equals(((Recipient) o).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Recipient{id=" + id + "}";
  }

  /** Builder for {@link Recipient}. */
  public static final class Builder {
    private final String id;
    private final Map<Channel, String> addresses = new EnumMap<>(Channel.class);
    private String chatWorkspace;
    private RecipientPreferences preferences;

    private Builder(String id) {
      this.id = id;
    }

    public Builder address(Channel channel, String address) {
      Objects.requireNonNull(channel, "channel");
      if (address == null) {
        addresses.remove(channel);
      } else {
        addresses.put(channel, address);
      }
      return this;
    }

    public Builder email(String email) {
      return address(Channel.EMAIL, email);
    }

    public Builder chat(String workspace, String userId) {
      this.chatWorkspace = workspace;
      return address(Channel.CHAT, userId);
    }

    public Builder phone(String phoneNumber) {
      return address(Channel.SMS, phoneNumber);
    }

    public Builder preferences(RecipientPreferences preferences) {
      this.preferences = preferences;
      return this;
    }

    public Recipient build() {
      return new Recipient(this);
    }
  }
}
