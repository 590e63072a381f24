package notifier.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotifierPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(NotifierProperties.class);
      assertTrue(props.getScheduler().isEnabled());
      assertEquals(Duration.ofSeconds(60), props.getScheduler().getTickInterval());
      assertEquals(4, props.getScheduler().getFireThreads());
      assertEquals(8, props.getDispatch().getDeliveryThreads());
      assertNull(props.getDispatch().getFallbackChatChannel());
      assertEquals(1000, props.getDispatch().getRecordQueueCapacity());
      assertEquals(3, props.getRetry().getMaxRetries());
      assertEquals(Duration.ofSeconds(1), props.getRetry().getBaseDelay());
      assertEquals(Duration.ofSeconds(30), props.getRetry().getMaxDelay());
      assertEquals(Duration.ofMinutes(5), props.getBatch().getFlushInterval());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("notifier", props.getMetrics().getNamePrefix());
      assertTrue(props.getJdbc().isEnabled());
      assertFalse(props.getJdbc().isInitializeSchema());
      assertEquals("notifier_schedule", props.getJdbc().getScheduleTable());
      assertEquals("notifier_deferred_dispatch", props.getJdbc().getDeferredTable());
      assertEquals("notifier_dispatch_record", props.getJdbc().getRecordTable());
      assertEquals("notifier_delivery_outcome", props.getJdbc().getOutcomeTable());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "notifier.scheduler.enabled=false",
        "notifier.scheduler.tick-interval=15s",
        "notifier.scheduler.fire-threads=2",
        "notifier.dispatch.delivery-threads=16",
        "notifier.dispatch.fallback-chat-channel=#ops",
        "notifier.retry.max-retries=5",
        "notifier.retry.base-delay=250ms",
        "notifier.retry.max-delay=1m",
        "notifier.batch.flush-interval=10m",
        "notifier.metrics.name-prefix=billing.notifier",
        "notifier.jdbc.initialize-schema=true",
        "notifier.jdbc.schedule-table=my_schedules"
    ).run(ctx -> {
      var props = ctx.getBean(NotifierProperties.class);
      assertFalse(props.getScheduler().isEnabled());
      assertEquals(Duration.ofSeconds(15), props.getScheduler().getTickInterval());
      assertEquals(2, props.getScheduler().getFireThreads());
      assertEquals(16, props.getDispatch().getDeliveryThreads());
      assertEquals("#ops", props.getDispatch().getFallbackChatChannel());
      assertEquals(5, props.getRetry().getMaxRetries());
      assertEquals(Duration.ofMillis(250), props.getRetry().getBaseDelay());
      assertEquals(Duration.ofMinutes(1), props.getRetry().getMaxDelay());
      assertEquals(Duration.ofMinutes(10), props.getBatch().getFlushInterval());
      assertEquals("billing.notifier", props.getMetrics().getNamePrefix());
      assertTrue(props.getJdbc().isInitializeSchema());
      assertEquals("my_schedules", props.getJdbc().getScheduleTable());
    });
  }

  @Configuration
  @EnableConfigurationProperties(NotifierProperties.class)
  static class PropsConfig {
  }
}
