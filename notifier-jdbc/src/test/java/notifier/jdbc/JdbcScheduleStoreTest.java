package notifier.jdbc;

import notifier.JobDescriptor;
import notifier.ScheduleConfig;
import notifier.schedule.ScheduleDefinition;
import notifier.schedule.ScheduleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcScheduleStoreTest {

  private H2Database db;
  private JdbcScheduleStore store;

  @BeforeEach
  void setUp() {
    db = new H2Database();
    store = new JdbcScheduleStore(db.connections);
  }

  private static ScheduleConfig schedule(String id, String name) {
    return new ScheduleConfig(id, name, "0 9 * * 1", ZoneId.of("Europe/Berlin"),
        new JobDescriptor("digest", Map.of("team", "platform")), true, 2, "alice",
        null, Instant.parse("2024-01-08T08:00:00Z"));
  }

  @Test
  void saveInsertsThenLoadsAllFields() {
    store.saveSchedule(schedule("s1", "weekly digest"));

    List<ScheduleConfig> loaded = store.loadAllSchedules();

    assertEquals(1, loaded.size());
    ScheduleConfig s = loaded.get(0);
    assertEquals("s1", s.id());
    assertEquals("weekly digest", s.name());
    assertEquals("0 9 * * 1", s.cron());
    assertEquals(ZoneId.of("Europe/Berlin"), s.timezone());
    assertEquals("digest", s.jobType());
    assertEquals("platform", s.job().params().get("team"));
    assertTrue(s.enabled());
    assertEquals(2, s.maxConcurrentRuns());
    assertEquals("alice", s.createdBy());
    assertNull(s.lastRun());
    assertEquals(Instant.parse("2024-01-08T08:00:00Z"), s.nextRun());
  }

  @Test
  void saveReplacesExistingRow() throws SQLException {
    store.saveSchedule(schedule("s1", "weekly digest"));
    store.saveSchedule(schedule("s1", "weekly digest").disabled());

    assertEquals(1, db.count("SELECT COUNT(*) FROM notifier_schedule"));
    ScheduleConfig s = store.loadAllSchedules().get(0);
    assertFalse(s.enabled());
    assertNull(s.nextRun());
  }

  @Test
  void nullConcurrencyCapAndEmptyParamsRoundTrip() {
    store.saveSchedule(new ScheduleConfig("s2", "cleanup", "0 3 * * *", ZoneOffset.UTC,
        JobDescriptor.of("cleanup"), true, null, null, null, null));

    ScheduleConfig s = store.loadAllSchedules().get(0);
    assertNull(s.maxConcurrentRuns());
    assertTrue(s.job().params().isEmpty());
    assertNull(s.createdBy());
  }

  @Test
  void deleteRemovesRow() {
    store.saveSchedule(schedule("s1", "a"));
    store.saveSchedule(schedule("s2", "b"));

    store.deleteSchedule("s1");

    List<ScheduleConfig> loaded = store.loadAllSchedules();
    assertEquals(1, loaded.size());
    assertEquals("s2", loaded.get(0).id());
  }

  @Test
  void loadOrdersByName() {
    store.saveSchedule(schedule("s1", "zeta"));
    store.saveSchedule(schedule("s2", "alpha"));

    assertEquals(List.of("alpha", "zeta"),
        store.loadAllSchedules().stream().map(ScheduleConfig::name).toList());
  }

  @Test
  void invalidTableNameRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new JdbcScheduleStore(db.connections, "schedules; DROP TABLE x"));
  }

  @Test
  void missingTableSurfacesAsStoreException() throws SQLException {
    db.execute("DROP TABLE notifier_schedule");

    assertThrows(NotifierStoreException.class, () -> store.loadAllSchedules());
  }

  // ── Registry integration ───────────────────────────────────────

  @Test
  void registrySurvivesRestartThroughStore() {
    Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    ScheduleRegistry first = ScheduleRegistry.builder().store(store).clock(clock).build();
    ScheduleConfig added = first.add(ScheduleDefinition.builder()
        .name("nightly")
        .cron("0 2 * * *")
        .job("cleanup", Map.of())
        .build());

    ScheduleRegistry second = ScheduleRegistry.builder().store(store).clock(clock).build();
    assertEquals(1, second.loadFromStore());

    ScheduleConfig restored = second.get(added.id()).orElseThrow();
    assertEquals("nightly", restored.name());
    assertEquals(Instant.parse("2024-01-01T02:00:00Z"), restored.nextRun());
  }
}
