package notifier.rules;

import java.util.Objects;

/**
 * Conditional rewrite of a dispatch request: when {@link #conditions()} match,
 * {@link #actions()} are applied. Higher {@link #priority()} runs first.
 *
 * @param id         unique id
 * @param name       display name
 * @param priority   ordering key, higher first
 * @param active     inactive rules are ignored
 * @param conditions when the rule applies
 * @param actions    what it changes
 */
public record NotificationRule(String id, String name, int priority, boolean active,
    RuleConditions conditions, RuleActions actions) {

  public NotificationRule {
    Objects.requireNonNull(id, "id");
    name = name == null ? id : name;
    conditions = conditions == null ? RuleConditions.any() : conditions;
    Objects.requireNonNull(actions, "actions");
  }

  public static NotificationRule of(String id, int priority, RuleConditions conditions, RuleActions actions) {
    return new NotificationRule(id, id, priority, true, conditions, actions);
  }
}
