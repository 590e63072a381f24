package notifier.jdbc;

import notifier.Category;
import notifier.Channel;
import notifier.ChannelPreference;
import notifier.DispatchRequest;
import notifier.Recipient;
import notifier.RecipientPreferences;
import notifier.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcDeferredDispatchStoreTest {

  private static final Instant NOON = Instant.parse("2024-01-01T12:00:00Z");

  private JdbcDeferredDispatchStore store;

  @BeforeEach
  void setUp() {
    store = new JdbcDeferredDispatchStore(new H2Database().connections);
  }

  private static Recipient recipient(String id) {
    return Recipient.builder(id)
        .email(id + "@example.com")
        .preferences(RecipientPreferences.builder()
            .allCategories()
            .channel(ChannelPreference.enabled(Channel.EMAIL, 1))
            .build())
        .build();
  }

  private static DispatchRequest request(String id, Instant scheduledFor) {
    return DispatchRequest.builder("release", Category.SYSTEM, Severity.HIGH)
        .id(id)
        .title("Release 1.4")
        .message("Rolling out at noon")
        .channels(Channel.EMAIL, Channel.CHAT)
        .template("release_notes")
        .templateValue("version", "1.4")
        .templateValue("count", 3)
        .metadata("source", "ci")
        .scheduledFor(scheduledFor)
        .build();
  }

  @Test
  void savedRequestComesBackWhenDue() {
    Instant at = NOON.plusSeconds(600);
    store.saveScheduled(request("d1", at), List.of(recipient("a"), recipient("b")), at);

    assertTrue(store.findDue(NOON, 10).isEmpty());

    List<DeferredDispatch> due = store.findDue(at, 10);
    assertEquals(1, due.size());
    DeferredDispatch deferred = due.get(0);
    assertEquals("d1", deferred.id());
    assertEquals(at, deferred.scheduledFor());
    assertEquals(List.of("a", "b"), deferred.recipientIds());

    DispatchRequest restored = deferred.request();
    assertEquals("release", restored.type());
    assertEquals(Category.SYSTEM, restored.category());
    assertEquals(Severity.HIGH, restored.severity());
    assertEquals("Release 1.4", restored.title());
    assertEquals(EnumSet.of(Channel.EMAIL, Channel.CHAT), restored.channels());
    assertEquals("release_notes", restored.template());
    assertEquals("1.4", restored.templateData().get("version"));
    assertEquals("3", restored.templateData().get("count"));
    assertEquals(Map.of("source", "ci"), restored.metadata());
  }

  @Test
  void unrestrictedChannelsStayUnrestricted() {
    DispatchRequest request = DispatchRequest.builder("release", Category.SYSTEM, Severity.LOW)
        .id("d2")
        .build();
    store.saveScheduled(request, List.of(), NOON);

    DeferredDispatch deferred = store.findDue(NOON, 10).get(0);
    assertNull(deferred.request().channels());
    assertTrue(deferred.recipientIds().isEmpty());
  }

  @Test
  void markSubmittedRemovesFromDueOnce() {
    store.saveScheduled(request("d1", NOON), List.of(recipient("a")), NOON);

    assertTrue(store.markSubmitted("d1"));
    assertFalse(store.markSubmitted("d1"));
    assertTrue(store.findDue(NOON.plusSeconds(3600), 10).isEmpty());
  }

  @Test
  void cancelOnlyAffectsPendingRows() {
    store.saveScheduled(request("d1", NOON), List.of(), NOON);
    store.saveScheduled(request("d2", NOON), List.of(), NOON);
    store.markSubmitted("d2");

    assertTrue(store.cancel("d1"));
    assertFalse(store.cancel("d2"));
    assertFalse(store.cancel("missing"));
  }

  @Test
  void findDueHonoursLimitAndOrder() {
    store.saveScheduled(request("late", NOON.plusSeconds(60)), List.of(), NOON.plusSeconds(60));
    store.saveScheduled(request("early", NOON), List.of(), NOON);
    store.saveScheduled(request("latest", NOON.plusSeconds(120)), List.of(), NOON.plusSeconds(120));

    List<DeferredDispatch> due = store.findDue(NOON.plusSeconds(600), 2);

    assertEquals(2, due.size());
    assertEquals("early", due.get(0).id());
    assertEquals("late", due.get(1).id());
  }

  @Test
  void findDueRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> store.findDue(NOON, 0));
  }

  @Test
  void toRequestResolvesRecipientsAndKeepsSchedule() {
    store.saveScheduled(request("d1", NOON), List.of(recipient("a"), recipient("gone")), NOON);
    DeferredDispatch deferred = store.findDue(NOON, 10).get(0);

    DispatchRequest resubmitted = deferred.toRequest(id -> "gone".equals(id) ? null : recipient(id));

    assertEquals("d1", resubmitted.id());
    assertEquals(1, resubmitted.recipients().size());
    assertEquals("a", resubmitted.recipients().get(0).id());
    assertEquals(NOON, resubmitted.scheduledFor());
    assertFalse(resubmitted.isScheduledAfter(NOON));
  }
}
