package notifier.dispatch;

import notifier.Category;
import notifier.Channel;
import notifier.ChannelPreference;
import notifier.DeliveryFrequency;
import notifier.DeliveryOutcome;
import notifier.DispatchRequest;
import notifier.DispatchResult;
import notifier.MutableClock;
import notifier.QuietHours;
import notifier.Recipient;
import notifier.RecipientPreferences;
import notifier.Severity;
import notifier.TestRecipients;
import notifier.delivery.ChannelRoute;
import notifier.delivery.ChannelRoutes;
import notifier.delivery.ChatMessage;
import notifier.delivery.EmailMessage;
import notifier.delivery.ProviderFailover;
import notifier.delivery.ProviderRegistry;
import notifier.delivery.WebhookMessage;
import notifier.rules.NotificationRule;
import notifier.rules.RuleActions;
import notifier.rules.RuleConditions;
import notifier.rules.RuleRegistry;
import notifier.spi.MetricsExporter;
import notifier.spi.RenderedContent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchEngineTest {

  private final MutableClock clock = MutableClock.at("2024-01-01T12:00:00Z");
  private final RecordingProvider email = RecordingProvider.ok(Channel.EMAIL);
  private final RecordingProvider chat = RecordingProvider.ok(Channel.CHAT);
  private final ProviderRegistry providers = new ProviderRegistry().register(email).register(chat);
  private final RuleRegistry rules = new RuleRegistry();
  private final List<DispatchRequest> deferred = new ArrayList<>();
  private DispatchEngine engine;

  private DispatchEngine.Builder engine() {
    return DispatchEngine.builder()
        .providers(providers)
        .rules(rules)
        .clock(clock)
        .deliveryExecutor(Runnable::run)
        .failover(new ProviderFailover(duration -> { }, Duration.ZERO, MetricsExporter.NOOP))
        .routes(ChannelRoutes.of(new ChannelRoute(2, Duration.ZERO, Duration.ZERO)))
        .deferredStore((request, recipients, scheduledFor) -> deferred.add(request));
  }

  private DispatchEngine build(DispatchEngine.Builder builder) {
    engine = builder.build();
    return engine;
  }

  @AfterEach
  void close() {
    if (engine != null) {
      engine.close();
    }
  }

  private static DispatchRequest.Builder alert(Severity severity, Recipient... recipients) {
    return DispatchRequest.builder("deploy", Category.ALERT, severity)
        .title("Deploy failed")
        .message("api-server rollout aborted")
        .recipients(List.of(recipients));
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingProviders() {
    assertThrows(NullPointerException.class, () -> DispatchEngine.builder().build());
  }

  @Test
  void builderRejectsZeroDeliveryThreads() {
    assertThrows(IllegalArgumentException.class,
        () -> DispatchEngine.builder().providers(providers).deliveryThreads(0).build());
  }

  // ── Immediate delivery ─────────────────────────────────────────

  @Test
  void deliversEachRecipientOnItsPreferredChannel() {
    DispatchEngine dispatcher = build(engine());
    Recipient a = TestRecipients.emailUser("a");
    Recipient b = TestRecipients.chatUser("b");

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, a, b).build());

    assertEquals(DispatchResult.Disposition.DELIVERED, result.disposition());
    assertTrue(result.success());
    assertEquals(2, result.successful());
    assertEquals(0, result.failed());
    assertNull(result.error());
    assertEquals(2, result.totalRecipients());
    assertEquals(1, email.sent.size());
    assertEquals(1, chat.sent.size());
    EmailMessage mail = (EmailMessage) email.sent.get(0);
    assertEquals("a@example.com", mail.to());
    assertEquals("Deploy failed", mail.subject());
    ChatMessage chatMessage = (ChatMessage) chat.sent.get(0);
    assertEquals("U-b", chatMessage.target());
    assertEquals("acme", chatMessage.workspace());
  }

  @Test
  void partialFailureIsReported() {
    ProviderRegistry mixed = new ProviderRegistry()
        .register(email)
        .register(RecordingProvider.failing(Channel.CHAT));
    DispatchEngine dispatcher = build(engine().providers(mixed));

    DispatchResult result = dispatcher.dispatch(
        alert(Severity.HIGH, TestRecipients.emailUser("a"), TestRecipients.chatUser("b")).build());

    assertTrue(result.success());
    assertTrue(result.isPartialFailure());
    assertEquals("1 deliveries failed", result.error());
    DeliveryOutcome failure = result.outcomes().stream().filter(o -> !o.success()).findFirst().orElseThrow();
    assertEquals(Channel.CHAT, failure.channel());
    assertEquals("U-b", failure.recipient());
    assertTrue(failure.error().startsWith("All chat providers failed. Last error:"));
  }

  @Test
  void totalFailureIsNotSuccess() {
    ProviderRegistry down = new ProviderRegistry().register(RecordingProvider.failing(Channel.EMAIL));
    DispatchEngine dispatcher = build(engine().providers(down));

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).build());

    assertFalse(result.success());
    assertEquals("1 deliveries failed", result.error());
  }

  @Test
  void missingAddressBecomesFailedOutcome() {
    Recipient noEmail = Recipient.builder("u42")
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.enabled(Channel.EMAIL, 1))
            .build())
        .build();
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, noEmail).build());

    assertEquals(1, result.failed());
    DeliveryOutcome outcome = result.outcomes().get(0);
    assertEquals("user_u42", outcome.recipient());
    assertEquals("No email address available", outcome.error());
    assertTrue(email.sent.isEmpty());
  }

  @Test
  void webhookAddressComesFromChannelConfig() {
    RecordingProvider webhook = RecordingProvider.ok(Channel.WEBHOOK);
    providers.register(webhook);
    Recipient hook = Recipient.builder("ci")
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.webhook("https://hooks.example.com/ci", 1))
            .build())
        .build();
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, hook).build());

    assertTrue(result.success());
    WebhookMessage message = (WebhookMessage) webhook.sent.get(0);
    assertEquals("https://hooks.example.com/ci", message.url());
    assertEquals("Deploy failed", message.body().get("title"));
  }

  @Test
  void requestedChannelsRestrictSelection() {
    Recipient both = TestRecipients.withPreferences("u1", RecipientPreferences.builder()
        .allCategories()
        .channel(ChannelPreference.enabled(Channel.EMAIL, 10))
        .channel(ChannelPreference.enabled(Channel.CHAT, 1))
        .build());
    DispatchEngine dispatcher = build(engine());

    dispatcher.dispatch(alert(Severity.HIGH, both).channels(Channel.CHAT).build());

    assertTrue(email.sent.isEmpty());
    assertEquals(1, chat.sent.size());
  }

  @Test
  void recipientWithoutAllowedChannelIsReportedUnroutable() {
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(
        alert(Severity.HIGH, TestRecipients.emailUser("a")).channels(Channel.SMS).build());

    assertFalse(result.success());
    assertEquals("No allowed channel for recipient", result.outcomes().get(0).error());
  }

  @Test
  void templateRendererSuppliesContent() {
    DispatchEngine dispatcher = build(engine().templateRenderer((template, data) ->
        Optional.of(new RenderedContent("[" + template + "] " + data.get("title"), "rendered body", "<p>hi</p>"))));

    dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).template("incident").build());

    EmailMessage mail = (EmailMessage) email.sent.get(0);
    assertEquals("[incident] Deploy failed", mail.subject());
    assertEquals("rendered body", mail.text());
    assertEquals("<p>hi</p>", mail.html());
  }

  // ── Filtering and fallback ─────────────────────────────────────

  @Test
  void minimumSeverityExcludesMediumButNotCritical() {
    Recipient strict = TestRecipients.withPreferences("u1", RecipientPreferences.builder()
        .allCategories()
        .channel(ChannelPreference.enabled(Channel.EMAIL, 1))
        .minimumSeverity(Severity.HIGH)
        .build());
    DispatchEngine dispatcher = build(engine());

    DispatchResult medium = dispatcher.dispatch(alert(Severity.MEDIUM, strict).build());
    assertEquals(DispatchResult.Disposition.NO_ELIGIBLE_RECIPIENTS, medium.disposition());
    assertFalse(medium.success());
    assertEquals("No eligible recipients", medium.error());

    DispatchResult critical = dispatcher.dispatch(alert(Severity.CRITICAL, strict).build());
    assertTrue(critical.success());
  }

  @Test
  void quietHoursHoldBackMediumButLetCriticalThrough() {
    Recipient sleeper = TestRecipients.withPreferences("u1", RecipientPreferences.builder()
        .allCategories()
        .channel(ChannelPreference.enabled(Channel.EMAIL, 1))
        .quietHours(QuietHours.of("22:00", "06:00", "UTC"))
        .build());
    clock.set(Instant.parse("2024-01-01T23:30:00Z"));
    DispatchEngine dispatcher = build(engine());

    assertFalse(dispatcher.dispatch(alert(Severity.MEDIUM, sleeper).build()).success());
    assertTrue(dispatcher.dispatch(alert(Severity.CRITICAL, sleeper).build()).success());
    assertEquals(1, email.sent.size());
  }

  @Test
  void noEligibleRecipientsFallsBackToDefaultChatChannel() {
    DispatchEngine dispatcher = build(engine().fallbackPolicy(new DefaultChannelFallback("#ops-alerts")));

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH).build());

    assertTrue(result.success());
    assertEquals(DispatchResult.Disposition.DELIVERED, result.disposition());
    assertEquals("#ops-alerts", ((ChatMessage) chat.sent.get(0)).target());
  }

  // ── Batching, deferral, expiry ─────────────────────────────────

  @Test
  void batchedRecipientsQueueUntilFlush() {
    Recipient a = batched("a");
    Recipient b = batched("b");
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.MEDIUM, a, b).build());

    assertEquals(DispatchResult.Disposition.BATCHED, result.disposition());
    assertTrue(result.success());
    assertTrue(result.outcomes().isEmpty());
    assertTrue(email.sent.isEmpty());
    assertEquals(1, dispatcher.batchAggregator().pendingCount());

    List<DispatchResult> flushed = dispatcher.batchAggregator().flush();

    assertEquals(1, flushed.size());
    assertEquals(2, flushed.get(0).successful());
    assertEquals(2, email.sent.size());
    assertEquals("1 alert notifications", ((EmailMessage) email.sent.get(0)).subject());
  }

  @Test
  void batchedRequestScheduledForLaterIsHeldUntilDue() {
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.MEDIUM, batched("a"))
        .scheduledFor(Instant.parse("2024-01-02T12:00:00Z"))
        .build());
    assertEquals(DispatchResult.Disposition.BATCHED, result.disposition());

    clock.set(Instant.parse("2024-01-01T12:05:00Z"));
    assertTrue(dispatcher.batchAggregator().flush().isEmpty());
    assertTrue(email.sent.isEmpty());

    clock.set(Instant.parse("2024-01-02T12:00:00Z"));
    assertEquals(1, dispatcher.batchAggregator().flush().size());
    assertEquals(1, email.sent.size());
  }

  @Test
  void criticalRequestsAreNeverBatched() {
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.CRITICAL, batched("a")).build());

    assertEquals(DispatchResult.Disposition.DELIVERED, result.disposition());
    assertEquals(1, email.sent.size());
    assertEquals(0, dispatcher.batchAggregator().pendingCount());
  }

  @Test
  void futureScheduledRequestIsDeferred() {
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a"))
        .scheduledFor(Instant.parse("2024-01-01T13:00:00Z"))
        .build());

    assertEquals(DispatchResult.Disposition.DEFERRED, result.disposition());
    assertTrue(result.success());
    assertEquals(1, deferred.size());
    assertTrue(email.sent.isEmpty());
  }

  @Test
  void ruleDelayDefersRequest() {
    rules.register(NotificationRule.of("delay-digests", 1,
        RuleConditions.builder().category(Category.ALERT).build(),
        RuleActions.builder().delay(Duration.ofMinutes(10)).build()));
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).build());

    assertEquals(DispatchResult.Disposition.DEFERRED, result.disposition());
    assertEquals(Instant.parse("2024-01-01T12:10:00Z"), deferred.get(0).scheduledFor());
  }

  @Test
  void ruleDelayedRequestIsDeliveredWhenResubmittedAfterItsTime() {
    rules.register(NotificationRule.of("delay-digests", 1,
        RuleConditions.builder().category(Category.ALERT).build(),
        RuleActions.builder().delay(Duration.ofMinutes(10)).build()));
    DispatchEngine dispatcher = build(engine());
    dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).build());

    clock.set(Instant.parse("2024-01-01T12:11:00Z"));
    DispatchResult resubmitted = dispatcher.dispatch(deferred.get(0));

    assertEquals(DispatchResult.Disposition.DELIVERED, resubmitted.disposition());
    assertEquals(1, deferred.size());
    assertEquals(1, email.sent.size());
  }

  @Test
  void expiredRequestIsNotSent() {
    DispatchEngine dispatcher = build(engine());

    DispatchResult result = dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a"))
        .expiresAt(Instant.parse("2024-01-01T11:59:00Z"))
        .build());

    assertEquals(DispatchResult.Disposition.EXPIRED, result.disposition());
    assertFalse(result.success());
    assertTrue(email.sent.isEmpty());
  }

  // ── Records ────────────────────────────────────────────────────

  @Test
  void outcomesAreRecordedAsynchronously() throws InterruptedException {
    CountDownLatch recorded = new CountDownLatch(1);
    List<DeliveryOutcome> saved = new ArrayList<>();
    DispatchEngine dispatcher = build(engine().recordStore((dispatchId, request, outcomes) -> {
      saved.addAll(outcomes);
      recorded.countDown();
    }));

    dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).build());

    assertTrue(recorded.await(5, TimeUnit.SECONDS));
    assertEquals(1, saved.size());
  }

  @Test
  void failingRecordStoreDoesNotAffectResult() {
    DispatchEngine dispatcher = build(engine().recordStore((dispatchId, request, outcomes) -> {
      throw new IllegalStateException("db down");
    }));

    assertTrue(dispatcher.dispatch(alert(Severity.HIGH, TestRecipients.emailUser("a")).build()).success());
  }

  private static Recipient batched(String id) {
    return Recipient.builder(id)
        .email(id + "@example.com")
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.enabled(Channel.EMAIL, 1))
            .frequency(DeliveryFrequency.BATCHED)
            .build())
        .build();
  }
}
