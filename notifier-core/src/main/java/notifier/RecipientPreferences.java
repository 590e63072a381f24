package notifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Delivery preferences of a single {@link Recipient}.
 */
public final class RecipientPreferences {
  private final List<ChannelPreference> channels;
  private final DeliveryFrequency frequency;
  private final Set<Category> categories;
  private final Severity minimumSeverity;
  private final QuietHours quietHours;

  private RecipientPreferences(Builder builder) {
    this.channels = List.copyOf(builder.channels);
    this.frequency = builder.frequency == null ? DeliveryFrequency.IMMEDIATE : builder.frequency;
    this.categories = builder.categories.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(builder.categories));
    this.minimumSeverity = builder.minimumSeverity;
    this.quietHours = builder.quietHours;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<ChannelPreference> channels() {
    return channels;
  }

  /**
   * Enabled channels, highest priority first. Ties keep declaration order.
   */
  public List<ChannelPreference> enabledChannelsByPriority() {
    List<ChannelPreference> enabled = new ArrayList<>();
    for (ChannelPreference pref : channels) {
      if (pref.enabled()) {
        enabled.add(pref);
      }
    }
    enabled.sort(Comparator.comparingInt(ChannelPreference::priority).reversed());
    return enabled;
  }

  public boolean hasEnabledChannel() {
    for (ChannelPreference pref : channels) {
      if (pref.enabled()) {
        return true;
      }
    }
    return false;
  }

  public Optional<ChannelPreference> channel(Channel channel) {
    for (ChannelPreference pref : channels) {
      if (pref.channel() == channel) {
        return Optional.of(pref);
      }
    }
    return Optional.empty();
  }

  public DeliveryFrequency frequency() {
    return frequency;
  }

  public Set<Category> categories() {
    return categories;
  }

  public boolean acceptsCategory(Category category) {
    return categories.contains(category);
  }

  /** Returns the minimum severity, or {@code null} if every severity is accepted. */
  public Severity minimumSeverity() {
    return minimumSeverity;
  }

  /** Returns the quiet-hours window, or {@code null} if none is configured. */
  public QuietHours quietHours() {
    return quietHours;
  }

  /** Builder for {@link RecipientPreferences}. */
  public static final class Builder {
    private final List<ChannelPreference> channels = new ArrayList<>();
    private DeliveryFrequency frequency;
    private final Set<Category> categories = EnumSet.noneOf(Category.class);
    private Severity minimumSeverity;
    private QuietHours quietHours;

    private Builder() {}

    public Builder channel(ChannelPreference channel) {
      this.channels.add(Objects.requireNonNull(channel, "channel"));
      return this;
    }

    public Builder channels(List<ChannelPreference> channels) {
      channels.forEach(this::channel);
      return this;
    }

    public Builder frequency(DeliveryFrequency frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder category(Category category) {
      this.categories.add(Objects.requireNonNull(category, "category"));
      return this;
    }

    public Builder categories(Set<Category> categories) {
      categories.forEach(this::category);
      return this;
    }

    public Builder allCategories() {
      this.categories.addAll(EnumSet.allOf(Category.class));
      return this;
    }

    public Builder minimumSeverity(Severity minimumSeverity) {
      this.minimumSeverity = minimumSeverity;
      return this;
    }

    public Builder quietHours(QuietHours quietHours) {
      this.quietHours = quietHours;
      return this;
    }

    public RecipientPreferences build() {
      return new RecipientPreferences(this);
    }
  }
}
