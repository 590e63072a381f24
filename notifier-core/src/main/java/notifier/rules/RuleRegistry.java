package notifier.rules;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe, copy-on-write set of notification rules, unique by id.
 */
public final class RuleRegistry {
  private final CopyOnWriteArrayList<NotificationRule> rules = new CopyOnWriteArrayList<>();

  /**
   * Adds a rule, replacing any rule with the same id.
   */
  public synchronized RuleRegistry register(NotificationRule rule) {
    Objects.requireNonNull(rule, "rule");
    rules.removeIf(existing -> existing.id().equals(rule.id()));
    rules.add(rule);
    return this;
  }

  public boolean remove(String id) {
    return rules.removeIf(rule -> rule.id().equals(id));
  }

  public Optional<NotificationRule> get(String id) {
    for (NotificationRule rule : rules) {
      if (rule.id().equals(id)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  /** Snapshot of all rules in registration order. */
  public List<NotificationRule> list() {
    return List.copyOf(rules);
  }
}
