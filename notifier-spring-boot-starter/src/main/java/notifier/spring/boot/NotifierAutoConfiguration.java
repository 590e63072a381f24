package notifier.spring.boot;

import notifier.delivery.ChannelRoute;
import notifier.delivery.ChannelRoutes;
import notifier.delivery.DeliveryProvider;
import notifier.delivery.ProviderFailover;
import notifier.delivery.ProviderRegistry;
import notifier.delivery.Sleeper;
import notifier.dispatch.DefaultChannelFallback;
import notifier.dispatch.DispatchEngine;
import notifier.dispatch.FallbackPolicy;
import notifier.rules.NotificationRule;
import notifier.rules.RuleRegistry;
import notifier.schedule.ScheduleListener;
import notifier.schedule.ScheduleRegistry;
import notifier.schedule.SchedulerLoop;
import notifier.spi.DeferredDispatchStore;
import notifier.spi.DispatchRecordStore;
import notifier.spi.JobCreator;
import notifier.spi.MetricsExporter;
import notifier.spi.RunCounter;
import notifier.spi.ScheduleStore;
import notifier.spi.TemplateRenderer;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the notifier.
 *
 * <p>Builds the provider and rule registries from {@link DeliveryProvider} and
 * {@link NotificationRule} beans, a {@link DispatchEngine}, a {@link ScheduleRegistry}
 * loaded from the {@link ScheduleStore} bean (if any) and, when a {@link JobCreator} bean
 * exists, a started {@link SchedulerLoop}. Optional collaborators ({@link TemplateRenderer},
 * {@link RunCounter}, {@link DeferredDispatchStore}, {@link DispatchRecordStore},
 * {@link MetricsExporter}, {@link ScheduleListener}) are picked up when present.
 *
 * @see NotifierProperties
 * @see NotifierJdbcAutoConfiguration
 * @see NotifierMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DispatchEngine.class)
@EnableConfigurationProperties(NotifierProperties.class)
public class NotifierAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ProviderRegistry providerRegistry(ObjectProvider<DeliveryProvider<?>> providers) {
    ProviderRegistry registry = new ProviderRegistry();
    providers.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public RuleRegistry ruleRegistry(ObjectProvider<NotificationRule> rules) {
    RuleRegistry registry = new RuleRegistry();
    rules.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public DispatchEngine dispatchEngine(NotifierProperties props,
      ProviderRegistry providerRegistry,
      RuleRegistry ruleRegistry,
      ObjectProvider<TemplateRenderer> templateRenderer,
      ObjectProvider<DeferredDispatchStore> deferredStore,
      ObjectProvider<DispatchRecordStore> recordStore,
      ObjectProvider<FallbackPolicy> fallbackPolicy,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    NotifierProperties.Retry retry = props.getRetry();
    ChannelRoute route = new ChannelRoute(retry.getMaxRetries(), retry.getBaseDelay(), retry.getMaxDelay());

    DispatchEngine.Builder builder = DispatchEngine.builder()
        .providers(providerRegistry)
        .rules(ruleRegistry)
        .failover(new ProviderFailover(Sleeper.SYSTEM, retry.getMaxDelay(), metrics))
        .routes(ChannelRoutes.of(route))
        .metrics(metrics)
        .deliveryThreads(props.getDispatch().getDeliveryThreads())
        .recordQueueCapacity(props.getDispatch().getRecordQueueCapacity())
        .batchFlushInterval(props.getBatch().getFlushInterval());
    templateRenderer.ifAvailable(builder::templateRenderer);
    deferredStore.ifAvailable(builder::deferredStore);
    recordStore.ifAvailable(builder::recordStore);

    FallbackPolicy fallback = fallbackPolicy.getIfAvailable();
    String fallbackChannel = props.getDispatch().getFallbackChatChannel();
    if (fallback != null) {
      builder.fallbackPolicy(fallback);
    } else if (fallbackChannel != null && !fallbackChannel.isBlank()) {
      builder.fallbackPolicy(new DefaultChannelFallback(fallbackChannel));
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ScheduleRegistry scheduleRegistry(ObjectProvider<ScheduleStore> store,
      ObjectProvider<ScheduleListener> listeners) {
    ScheduleRegistry.Builder builder = ScheduleRegistry.builder()
        .store(store.getIfAvailable(() -> ScheduleStore.NONE));
    listeners.orderedStream().forEach(builder::listener);
    ScheduleRegistry registry = builder.build();
    registry.loadFromStore();
    return registry;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(JobCreator.class)
  @ConditionalOnProperty(prefix = "notifier.scheduler", name = "enabled", matchIfMissing = true)
  public SchedulerLoop schedulerLoop(NotifierProperties props,
      ScheduleRegistry scheduleRegistry,
      JobCreator jobCreator,
      ObjectProvider<RunCounter> runCounter,
      ObjectProvider<MetricsExporter> metricsProvider) {
    NotifierProperties.Scheduler scheduler = props.getScheduler();
    SchedulerLoop.Builder builder = SchedulerLoop.builder()
        .registry(scheduleRegistry)
        .jobCreator(jobCreator)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .tickInterval(scheduler.getTickInterval())
        .fireThreads(scheduler.getFireThreads());
    runCounter.ifAvailable(builder::runCounter);
    return builder.build();
  }
}
