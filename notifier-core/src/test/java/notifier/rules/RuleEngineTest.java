package notifier.rules;

import notifier.Category;
import notifier.Channel;
import notifier.DispatchRequest;
import notifier.MutableClock;
import notifier.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleEngineTest {

  private final MutableClock clock = MutableClock.at("2024-01-01T12:00:00Z");
  private final RuleEngine engine = new RuleEngine(clock);

  private static DispatchRequest alert(Severity severity, String title) {
    return DispatchRequest.builder("deploy", Category.ALERT, severity)
        .title(title)
        .message("api-server rollout")
        .build();
  }

  @Test
  void noMatchingRuleReturnsRequestUnchanged() {
    DispatchRequest request = alert(Severity.LOW, "Deploy finished");
    NotificationRule rule = NotificationRule.of("r1", 10,
        RuleConditions.builder().category(Category.DIGEST).build(),
        RuleActions.builder().channels(Channel.CHAT).build());

    assertSame(request, engine.apply(List.of(rule), request));
  }

  @Test
  void matchingRuleOverridesChannelsDelayAndTemplate() {
    NotificationRule rule = NotificationRule.of("r1", 10,
        RuleConditions.builder().category(Category.ALERT).severity(Severity.HIGH).build(),
        RuleActions.builder()
            .channels(Channel.CHAT, Channel.EMAIL)
            .delay(Duration.ofMinutes(15))
            .template("alert_template")
            .build());

    DispatchRequest result = engine.apply(List.of(rule), alert(Severity.HIGH, "Deploy failed"));

    assertEquals(Set.of(Channel.CHAT, Channel.EMAIL), result.channels());
    assertEquals(Instant.parse("2024-01-01T12:15:00Z"), result.scheduledFor());
    assertEquals("alert_template", result.template());
    assertEquals(Severity.HIGH, result.severity());
    assertEquals(Category.ALERT, result.category());
  }

  @Test
  void delayLeavesExistingScheduleAlone() {
    NotificationRule rule = NotificationRule.of("r1", 10,
        RuleConditions.builder().category(Category.ALERT).build(),
        RuleActions.builder().delay(Duration.ofMinutes(15)).template("delayed").build());
    Instant due = Instant.parse("2024-01-01T11:50:00Z");

    DispatchRequest result = engine.apply(List.of(rule), alert(Severity.HIGH, "Deploy failed").withScheduledFor(due));

    assertEquals(due, result.scheduledFor());
    assertEquals("delayed", result.template());
  }

  @Test
  void keywordsMatchTitleOrMessageIgnoringCase() {
    NotificationRule rule = NotificationRule.of("r1", 10,
        RuleConditions.builder().keyword("ROLLOUT").build(),
        RuleActions.builder().template("deploys").build());

    assertEquals("deploys", engine.apply(List.of(rule), alert(Severity.LOW, "anything")).template());
  }

  @Test
  void lowerPriorityRuleAppliedLastWins() {
    NotificationRule high = NotificationRule.of("high", 100, RuleConditions.any(),
        RuleActions.builder().template("from-high").channels(Channel.EMAIL).build());
    NotificationRule low = NotificationRule.of("low", 1, RuleConditions.any(),
        RuleActions.builder().template("from-low").build());

    DispatchRequest result = engine.apply(List.of(low, high), alert(Severity.LOW, "x"));

    assertEquals("from-low", result.template());
    assertEquals(Set.of(Channel.EMAIL), result.channels());
  }

  @Test
  void inactiveRulesAreIgnored() {
    NotificationRule inactive = new NotificationRule("off", "off", 10, false, RuleConditions.any(),
        RuleActions.builder().template("never").build());

    assertNull(engine.apply(List.of(inactive), alert(Severity.LOW, "x")).template());
  }

  @Test
  void timeWindowWrapsMidnight() {
    TimeWindow night = new TimeWindow(LocalTime.of(22, 0), LocalTime.of(6, 0), ZoneId.of("UTC"));
    NotificationRule rule = NotificationRule.of("night", 10,
        RuleConditions.builder().timeWindow(night).build(),
        RuleActions.builder().channels(Channel.EMAIL).build());

    assertNull(engine.apply(List.of(rule), alert(Severity.LOW, "x")).channels());

    clock.set(Instant.parse("2024-01-01T23:30:00Z"));
    assertEquals(Set.of(Channel.EMAIL), engine.apply(List.of(rule), alert(Severity.LOW, "x")).channels());

    clock.set(Instant.parse("2024-01-02T06:00:00Z"));
    assertEquals(Set.of(Channel.EMAIL), engine.apply(List.of(rule), alert(Severity.LOW, "x")).channels());
  }

  @Test
  void registryReplacesRuleWithSameId() {
    RuleRegistry registry = new RuleRegistry()
        .register(NotificationRule.of("r1", 1, null, RuleActions.builder().template("a").build()))
        .register(NotificationRule.of("r1", 1, null, RuleActions.builder().template("b").build()));

    assertEquals(1, registry.list().size());
    assertEquals("b", registry.get("r1").orElseThrow().actions().template());
    assertTrue(registry.remove("r1"));
    assertEquals(0, registry.list().size());
  }
}
