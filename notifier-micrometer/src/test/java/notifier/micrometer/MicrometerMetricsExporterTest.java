package notifier.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void scheduleCounters() {
    exporter.incrementScheduleFired();
    exporter.incrementScheduleFired();
    exporter.incrementScheduleSkipped();
    exporter.incrementScheduleFailed();

    assertEquals(2.0, counter("notifier.schedule.fired").count());
    assertEquals(1.0, counter("notifier.schedule.skipped").count());
    assertEquals(1.0, counter("notifier.schedule.failed").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    exporter.incrementFailover();

    assertEquals(3.0, counter("notifier.dispatch.success").count());
    assertEquals(1.0, counter("notifier.dispatch.failure").count());
    assertEquals(1.0, counter("notifier.delivery.failover").count());
  }

  @Test
  void dispositionCounters() {
    exporter.incrementDispatchBatched();
    exporter.incrementDispatchDeferred();
    exporter.incrementDispatchDeferred();
    exporter.incrementNoEligibleRecipients();

    assertEquals(1.0, counter("notifier.dispatch.batched").count());
    assertEquals(2.0, counter("notifier.dispatch.deferred").count());
    assertEquals(1.0, counter("notifier.dispatch.no_eligible").count());
  }

  @Test
  void batchPendingGauge() {
    exporter.recordBatchPending(12);
    assertEquals(12.0, gauge("notifier.batch.pending").value());

    exporter.recordBatchPending(0);
    assertEquals(0.0, gauge("notifier.batch.pending").value());
  }

  @Test
  void dispatchDurationSummary() {
    exporter.recordDispatchDurationMs(40);
    exporter.recordDispatchDurationMs(60);

    DistributionSummary summary = registry.find("notifier.dispatch.duration").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(100.0, summary.totalAmount());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(other, "billing.notifier");
    custom.incrementScheduleFired();

    assertEquals(1.0, other.find("billing.notifier.schedule.fired").counter().count());
    assertNull(other.find("notifier.schedule.fired").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "notifier."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementScheduleFired();
    exporter.close();

    assertNull(registry.find("notifier.schedule.fired").counter());
    assertNull(registry.find("notifier.batch.pending").gauge());
    assertNull(registry.find("notifier.dispatch.duration").summary());
    assertTrue(registry.getMeters().isEmpty());

    exporter.incrementScheduleFired();
    exporter.recordBatchPending(5);
  }

  private Counter counter(String name) {
    Counter counter = registry.find(name).counter();
    assertNotNull(counter, "counter " + name);
    return counter;
  }

  private Gauge gauge(String name) {
    Gauge gauge = registry.find(name).gauge();
    assertNotNull(gauge, "gauge " + name);
    return gauge;
  }
}
