package notifier.rules;

import notifier.Category;
import notifier.DispatchRequest;
import notifier.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * What a request must look like for a rule to apply. Absent conditions always match;
 * present ones must all match.
 */
public final class RuleConditions {
  private final Set<Category> categories;
  private final Set<Severity> severities;
  private final List<String> keywords;
  private final TimeWindow timeWindow;

  private RuleConditions(Builder builder) {
    this.categories = builder.categories.isEmpty()
        ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(builder.categories));
    this.severities = builder.severities.isEmpty()
        ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(builder.severities));
    this.keywords = List.copyOf(builder.keywords);
    this.timeWindow = builder.timeWindow;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Conditions that match every request. */
  public static RuleConditions any() {
    return new Builder().build();
  }

  public Set<Category> categories() {
    return categories;
  }

  public Set<Severity> severities() {
    return severities;
  }

  public List<String> keywords() {
    return keywords;
  }

  public TimeWindow timeWindow() {
    return timeWindow;
  }

  boolean matches(DispatchRequest request, Instant now) {
    if (!categories.isEmpty() && !categories.contains(request.category())) {
      return false;
    }
    if (!severities.isEmpty() && !severities.contains(request.severity())) {
      return false;
    }
    if (!keywords.isEmpty() && !containsKeyword(request.title() + " " + request.message())) {
      return false;
    }
    return timeWindow == null || timeWindow.contains(now);
  }

  private boolean containsKeyword(String text) {
    String haystack = text.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  /** Builder for {@link RuleConditions}. */
  public static final class Builder {
    private final Set<Category> categories = EnumSet.noneOf(Category.class);
    private final Set<Severity> severities = EnumSet.noneOf(Severity.class);
    private final List<String> keywords = new ArrayList<>();
    private TimeWindow timeWindow;

    private Builder() {
    }

    public Builder category(Category... categories) {
      Collections.addAll(this.categories, categories);
      return this;
    }

    public Builder severity(Severity... severities) {
      Collections.addAll(this.severities, severities);
      return this;
    }

    /** Matches when any keyword occurs in the title or message, ignoring case. */
    public Builder keyword(String... keywords) {
      for (String keyword : keywords) {
        this.keywords.add(Objects.requireNonNull(keyword, "keyword"));
      }
      return this;
    }

    public Builder timeWindow(TimeWindow timeWindow) {
      this.timeWindow = timeWindow;
      return this;
    }

    public RuleConditions build() {
      return new RuleConditions(this);
    }
  }
}
