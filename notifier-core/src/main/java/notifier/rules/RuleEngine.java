package notifier.rules;

import notifier.DispatchRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies notification rules to a request.
 *
 * <p>Active rules run in descending priority. Each matching rule applies its channel
 * override, then its delay ({@code scheduledFor = now + delay}), then its template.
 * When several matching rules set the same field, the last applied (lowest priority)
 * wins. Category and severity are never changed.
 *
 * <p>Delays only apply to requests without a {@code scheduledFor}. A request that already
 * carries one, including a deferred request being resubmitted once due, keeps it.
 */
public final class RuleEngine {
  private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

  private static final Comparator<NotificationRule> BY_PRIORITY_DESC =
      Comparator.comparingInt(NotificationRule::priority).reversed();

  private final Clock clock;

  public RuleEngine() {
    this(Clock.systemUTC());
  }

  public RuleEngine(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @return the rewritten request, or {@code request} itself when no rule matched
   */
  public DispatchRequest apply(List<NotificationRule> rules, DispatchRequest request) {
    Objects.requireNonNull(request, "request");
    if (rules == null || rules.isEmpty()) {
      return request;
    }
    List<NotificationRule> ordered = new ArrayList<>();
    for (NotificationRule rule : rules) {
      if (rule.active()) {
        ordered.add(rule);
      }
    }
    ordered.sort(BY_PRIORITY_DESC);

    Instant now = clock.instant();
    DispatchRequest result = request;
    for (NotificationRule rule : ordered) {
      if (!rule.conditions().matches(request, now)) {
        continue;
      }
      logger.log(Level.FINE, "Rule {0} matched dispatch {1}", new Object[] {rule.id(), request.id()});
      RuleActions actions = rule.actions();
      if (actions.channels() != null) {
        result = result.withChannels(actions.channels());
      }
      if (actions.delay() != null && request.scheduledFor() == null) {
        result = result.withScheduledFor(now.plus(actions.delay()));
      }
      if (actions.template() != null) {
        result = result.withTemplate(actions.template());
      }
    }
    return result;
  }
}
