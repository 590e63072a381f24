package notifier.rules;

import notifier.Channel;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What a matching rule changes. Unset actions leave the request alone.
 */
public final class RuleActions {
  private final Set<Channel> channels;
  private final Duration delay;
  private final String template;

  private RuleActions(Builder builder) {
    this.channels = builder.channels == null ? null : Collections.unmodifiableSet(builder.channels);
    if (builder.delay != null && builder.delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0");
    }
    this.delay = builder.delay;
    this.template = builder.template;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Channel restriction to impose, or {@code null}. */
  public Set<Channel> channels() {
    return channels;
  }

  /** Delay before delivery, or {@code null}. */
  public Duration delay() {
    return delay;
  }

  /** Template to use, or {@code null}. */
  public String template() {
    return template;
  }

  /** Builder for {@link RuleActions}. */
  public static final class Builder {
    private Set<Channel> channels;
    private Duration delay;
    private String template;

    private Builder() {
    }

    public Builder channels(Channel... channels) {
      this.channels = channels.length == 0 ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(List.of(channels));
      return this;
    }

    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    public Builder template(String template) {
      this.template = template;
      return this;
    }

    public RuleActions build() {
      return new RuleActions(this);
    }
  }
}
