package notifier;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable request to notify a set of recipients about one thing.
 *
 * <p>A request is independent of how many recipients and channels it resolves to.
 * Each request is assigned a ULID-based {@code id} by default. Category and severity
 * are fixed at creation; the {@code with*} methods used by rule rewriting return copies
 * and never touch them.
 *
 * @see notifier.dispatch.DispatchEngine
 */
public final class DispatchRequest {
  private final String id;
  private final String type;
  private final Category category;
  private final Severity severity;
  private final String title;
  private final String message;
  private final List<Recipient> recipients;
  private final Set<Channel> channels;
  private final String template;
  private final Map<String, Object> templateData;
  private final Instant scheduledFor;
  private final Instant expiresAt;
  private final Map<String, String> metadata;

  private DispatchRequest(Builder builder) {
    this.id = builder.id == null ? newId() : builder.id;
    this.type = Objects.requireNonNull(builder.type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
    this.category = Objects.requireNonNull(builder.category, "category");
    this.severity = Objects.requireNonNull(builder.severity, "severity");
    this.title = builder.title == null ? "" : builder.title;
    this.message = builder.message == null ? "" : builder.message;
    this.recipients = List.copyOf(builder.recipients);
    this.channels = builder.channels == null ? null : Collections.unmodifiableSet(copyChannels(builder.channels));
    this.template = builder.template;
    this.templateData = builder.templateData.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.templateData));
    this.scheduledFor = builder.scheduledFor;
    this.expiresAt = builder.expiresAt;
    this.metadata = builder.metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
  }

  public static Builder builder(String type, Category category, Severity severity) {
    return new Builder(type, category, severity);
  }

  public String id() {
    return id;
  }

  public String type() {
    return type;
  }

  public Category category() {
    return category;
  }

  public Severity severity() {
    return severity;
  }

  public String title() {
    return title;
  }

  public String message() {
    return message;
  }

  public List<Recipient> recipients() {
    return recipients;
  }

  /**
   * Channels this request is restricted to, or {@code null} when any channel may be used.
   */
  public Set<Channel> channels() {
    return channels;
  }

  public boolean allowsChannel(Channel channel) {
    return channels == null || channels.contains(channel);
  }

  public String template() {
    return template;
  }

  public Map<String, Object> templateData() {
    return templateData;
  }

  public Instant scheduledFor() {
    return scheduledFor;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public Map<String, String> metadata() {
    return metadata;
  }

  public boolean isCritical() {
    return severity == Severity.CRITICAL;
  }

  public boolean isScheduledAfter(Instant now) {
    return scheduledFor != null && scheduledFor.isAfter(now);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public DispatchRequest withChannels(Collection<Channel> channels) {
    Builder copy = copy();
    copy.channels = channels == null ? null : copyChannels(channels);
    return copy.build();
  }

  public DispatchRequest withScheduledFor(Instant scheduledFor) {
    Builder copy = copy();
    copy.scheduledFor = scheduledFor;
    return copy.build();
  }

  public DispatchRequest withTemplate(String template) {
    Builder copy = copy();
    copy.template = template;
    return copy.build();
  }

  public DispatchRequest withRecipients(List<Recipient> recipients) {
    Builder copy = copy();
    copy.recipients.clear();
    copy.recipients.addAll(recipients);
    return copy.build();
  }

  private Builder copy() {
    Builder copy = new Builder(type, category, severity)
        .id(id)
        .title(title)
        .message(message)
        .recipients(recipients)
        .template(template)
        .templateData(templateData)
        .scheduledFor(scheduledFor)
        .expiresAt(expiresAt)
        .metadata(metadata);
    copy.channels = channels == null ? null : copyChannels(channels);
    return copy;
  }

  private static Set<Channel> copyChannels(Collection<Channel> channels) {
    return channels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(channels);
  }

  private static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  @Override
  public String toString() {
    return "DispatchRequest{id=" + id + ", type=" + type + ", category=" + category
        + ", severity=" + severity + ", recipients=" + recipients.size() + "}";
  }

  /** Builder for {@link DispatchRequest}. */
  public static final class Builder {
    private String id;
    private final String type;
    private final Category category;
    private final Severity severity;
    private String title;
    private String message;
    private final List<Recipient> recipients = new ArrayList<>();
    private Set<Channel> channels;
    private String template;
    private final Map<String, Object> templateData = new LinkedHashMap<>();
    private Instant scheduledFor;
    private Instant expiresAt;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private Builder(String type, Category category, Severity severity) {
      this.type = type;
      this.category = category;
      this.severity = severity;
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder recipient(Recipient recipient) {
      this.recipients.add(Objects.requireNonNull(recipient, "recipient"));
      return this;
    }

    public Builder recipients(List<Recipient> recipients) {
      recipients.forEach(this::recipient);
      return this;
    }

    public Builder channels(Channel... channels) {
      this.channels = copyChannels(List.of(channels));
      return this;
    }

    public Builder template(String template) {
      this.template = template;
      return this;
    }

    public Builder templateData(Map<String, ?> templateData) {
      if (templateData != null) {
        this.templateData.putAll(templateData);
      }
      return this;
    }

    public Builder templateValue(String key, Object value) {
      this.templateData.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder scheduledFor(Instant scheduledFor) {
      this.scheduledFor = scheduledFor;
      return this;
    }

    public Builder expiresAt(Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder metadata(Map<String, String> metadata) {
      if (metadata != null) {
        this.metadata.putAll(metadata);
      }
      return this;
    }

    public Builder metadata(String key, String value) {
      this.metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * Builds the request.
     *
     * @throws NullPointerException     if {@code type}, {@code category} or {@code severity} is null
     * @throws IllegalArgumentException if {@code type} is empty
     */
    public DispatchRequest build() {
      return new DispatchRequest(this);
    }
  }
}
