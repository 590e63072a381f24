package notifier.dispatch;

import notifier.Channel;
import notifier.ChannelPreference;
import notifier.DeliveryFrequency;
import notifier.DeliveryOutcome;
import notifier.DispatchRequest;
import notifier.DispatchResult;
import notifier.Recipient;
import notifier.RecipientPreferences;
import notifier.batch.BatchAggregator;
import notifier.delivery.ChannelRoutes;
import notifier.delivery.DeliveryAttempt;
import notifier.delivery.DeliveryProvider;
import notifier.delivery.OutboundMessage;
import notifier.delivery.ProviderFailover;
import notifier.delivery.ProviderRegistry;
import notifier.delivery.Sleeper;
import notifier.recipient.ChannelGrouper;
import notifier.recipient.RecipientFilter;
import notifier.rules.RuleEngine;
import notifier.rules.RuleRegistry;
import notifier.spi.DeferredDispatchStore;
import notifier.spi.DispatchRecordStore;
import notifier.spi.MetricsExporter;
import notifier.spi.TemplateRenderer;
import notifier.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for sending notifications.
 *
 * <p>{@link #dispatch} runs a request through these stages:
 * <ol>
 *   <li>expired requests are dropped;</li>
 *   <li>notification rules rewrite channels, delay and template;</li>
 *   <li>recipients are filtered by their preferences, falling back to the
 *       {@link FallbackPolicy} when nobody is left;</li>
 *   <li>non-critical requests for recipients who prefer batching go to the
 *       {@link BatchAggregator};</li>
 *   <li>requests scheduled for later go to the {@link DeferredDispatchStore};</li>
 *   <li>everything else is delivered now: one channel per recipient, concurrently,
 *       each through {@link ProviderFailover}.</li>
 * </ol>
 *
 * <p>Delivery problems never escape as exceptions; they are reported in the
 * {@link DispatchResult}. After an immediate delivery the outcomes are recorded
 * asynchronously through the {@link DispatchRecordStore}.
 *
 * <p>Create instances via {@link #builder()}. Call {@link #start()} to enable periodic
 * batch flushing and {@link #close()} to flush and release threads.
 */
public final class DispatchEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DispatchEngine.class.getName());

  private final ProviderRegistry providers;
  private final RuleRegistry rules;
  private final RuleEngine ruleEngine;
  private final RecipientFilter recipientFilter;
  private final ChannelGrouper channelGrouper;
  private final ProviderFailover failover;
  private final ChannelRoutes routes;
  private final MessageComposer composer;
  private final DeferredDispatchStore deferredStore;
  private final FallbackPolicy fallbackPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Executor deliveryExecutor;
  private final ExecutorService ownedDeliveryExecutor;
  private final AsyncRecordWriter recordWriter;
  private final BatchAggregator batchAggregator;

  private DispatchEngine(Builder builder) {
    this.providers = Objects.requireNonNull(builder.providers, "providers");
    this.rules = builder.rules != null ? builder.rules : new RuleRegistry();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ruleEngine = new RuleEngine(clock);
    this.recipientFilter = new RecipientFilter(clock);
    this.channelGrouper = new ChannelGrouper();
    this.failover = builder.failover != null
        ? builder.failover
        : new ProviderFailover(Sleeper.SYSTEM, Duration.ofSeconds(30), metrics);
    this.routes = builder.routes != null ? builder.routes : ChannelRoutes.defaults();
    this.composer = new MessageComposer(
        builder.templateRenderer != null ? builder.templateRenderer : TemplateRenderer.NONE);
    this.deferredStore = builder.deferredStore;
    this.fallbackPolicy = builder.fallbackPolicy != null ? builder.fallbackPolicy : FallbackPolicy.NONE;

    if (builder.deliveryExecutor != null) {
      this.deliveryExecutor = builder.deliveryExecutor;
      this.ownedDeliveryExecutor = null;
    } else {
      if (builder.deliveryThreads < 1) {
        throw new IllegalArgumentException("deliveryThreads must be >= 1");
      }
      this.ownedDeliveryExecutor = Executors.newFixedThreadPool(builder.deliveryThreads,
          new DaemonThreadFactory("notifier-delivery-"));
      this.deliveryExecutor = ownedDeliveryExecutor;
    }

    DispatchRecordStore recordStore = builder.recordStore != null ? builder.recordStore : DispatchRecordStore.NONE;
    this.recordWriter = recordStore == DispatchRecordStore.NONE
        ? null
        : new AsyncRecordWriter(recordStore, builder.recordQueueCapacity, 5_000);
    this.batchAggregator = BatchAggregator.builder()
        .sink(this::dispatchDigest)
        .flushInterval(builder.batchFlushInterval)
        .metrics(metrics)
        .clock(clock)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic batch flush.
   */
  public void start() {
    batchAggregator.start();
  }

  /**
   * Dispatches a request.
   *
   * @return the result; delivery failures are reported here, never thrown
   * @throws IllegalStateException if the request is scheduled for later and no
   *                               {@link DeferredDispatchStore} is configured
   */
  public DispatchResult dispatch(DispatchRequest request) {
    Objects.requireNonNull(request, "request");
    long startNanos = System.nanoTime();
    Instant now = clock.instant();

    if (request.isExpiredAt(now)) {
      logger.log(Level.WARNING, "Dispatch {0} expired at {1}, not sent", new Object[] {request.id(), request.expiresAt()});
      return finish(DispatchResult.expired(request.id(), elapsed(startNanos)));
    }

    DispatchRequest rewritten = ruleEngine.apply(rules.list(), request);

    List<Recipient> eligible = recipientFilter.filter(rewritten);
    if (eligible.isEmpty()) {
      return dispatchFallback(rewritten, startNanos);
    }

    if (!rewritten.isCritical() && anyPrefersBatching(eligible)) {
      batchAggregator.enqueue(rewritten, eligible);
      metrics.incrementDispatchBatched();
      logger.log(Level.FINE, "Dispatch {0} queued for batching", rewritten.id());
      return finish(DispatchResult.batched(rewritten.id(), eligible.size(), elapsed(startNanos)));
    }

    if (rewritten.isScheduledAfter(now)) {
      if (deferredStore == null) {
        throw new IllegalStateException("Dispatch " + rewritten.id()
            + " is scheduled for " + rewritten.scheduledFor() + " but no DeferredDispatchStore is configured");
      }
      deferredStore.saveScheduled(rewritten, eligible, rewritten.scheduledFor());
      metrics.incrementDispatchDeferred();
      logger.log(Level.INFO, "Dispatch {0} deferred until {1}", new Object[] {rewritten.id(), rewritten.scheduledFor()});
      return finish(DispatchResult.deferred(rewritten.id(), eligible.size(), elapsed(startNanos)));
    }

    return deliverNow(rewritten, eligible, startNanos);
  }

  /**
   * Delivers a digest produced by the batch aggregator. Its recipients were filtered
   * when the individual requests were queued.
   */
  DispatchResult dispatchDigest(DispatchRequest digest) {
    return deliverNow(digest, digest.recipients(), System.nanoTime());
  }

  private DispatchResult dispatchFallback(DispatchRequest request, long startNanos) {
    metrics.incrementNoEligibleRecipients();
    Optional<FallbackPolicy.Target> target = fallbackPolicy.fallbackFor(request);
    if (target.isEmpty()) {
      logger.log(Level.WARNING, "No eligible recipients for dispatch {0}", request.id());
      return finish(DispatchResult.noEligibleRecipients(request.id(), elapsed(startNanos)));
    }
    FallbackPolicy.Target fallback = target.get();
    logger.log(Level.INFO, "No eligible recipients for dispatch {0}, falling back to {1} {2}",
        new Object[] {request.id(), fallback.channel().code(), fallback.address()});
    Recipient standIn = Recipient.builder("fallback")
        .address(fallback.channel(), fallback.address())
        .preferences(RecipientPreferences.builder()
            .channel(ChannelPreference.enabled(fallback.channel(), 0))
            .build())
        .build();
    DeliveryOutcome outcome = deliverOne(fallback.channel(), request, standIn);
    List<DeliveryOutcome> outcomes = List.of(outcome);
    record(request, outcomes);
    return finish(DispatchResult.delivered(request.id(), 0, outcomes, elapsed(startNanos)));
  }

  private DispatchResult deliverNow(DispatchRequest request, List<Recipient> recipients, long startNanos) {
    Map<Channel, List<Recipient>> groups = channelGrouper.group(recipients, request::allowsChannel);

    Map<String, CompletableFuture<DeliveryOutcome>> pending = new LinkedHashMap<>();
    for (Map.Entry<Channel, List<Recipient>> group : groups.entrySet()) {
      Channel channel = group.getKey();
      for (Recipient recipient : group.getValue()) {
        String key = recipient.id() + "|" + channel.code();
        if (pending.containsKey(key)) {
          continue;
        }
        pending.put(key, CompletableFuture.supplyAsync(() -> deliverOne(channel, request, recipient), deliveryExecutor));
      }
    }

    List<DeliveryOutcome> outcomes = new ArrayList<>(pending.size() + 1);
    for (Recipient recipient : recipients) {
      if (channelGrouper.selectChannel(recipient, request::allowsChannel) == null) {
        outcomes.add(unroutable(request, recipient));
      }
    }
    for (CompletableFuture<DeliveryOutcome> future : pending.values()) {
      outcomes.add(future.join());
    }

    for (DeliveryOutcome outcome : outcomes) {
      if (outcome.success()) {
        metrics.incrementDeliverySuccess();
      } else {
        metrics.incrementDeliveryFailure();
      }
    }
    DispatchResult result = DispatchResult.delivered(request.id(), recipients.size(), outcomes, elapsed(startNanos));
    if (result.failed() > 0) {
      logger.log(Level.WARNING, "Dispatch {0}: {1} delivered, {2} failed",
          new Object[] {request.id(), result.successful(), result.failed()});
    } else {
      logger.log(Level.INFO, "Dispatch {0}: {1} delivered", new Object[] {request.id(), result.successful()});
    }
    record(request, outcomes);
    return finish(result);
  }

  /**
   * Delivers to one recipient on one channel. Never throws.
   */
  private DeliveryOutcome deliverOne(Channel channel, DispatchRequest request, Recipient recipient) {
    String address = recipient.address(channel);
    if (address == null) {
      return DeliveryOutcome.failed(channel, recipient.displayAddress(channel), null,
          "No " + channel.code() + " address available", clock.instant());
    }
    try {
      OutboundMessage message = composer.compose(channel, request, recipient, address);
      List<DeliveryProvider<OutboundMessage>> channelProviders = providers.providersFor(channel);
      DeliveryAttempt attempt = failover.sendWithFailover(channelProviders, message, routes.routeFor(channel));
      if (attempt.success()) {
        return DeliveryOutcome.delivered(channel, address, attempt.provider(), attempt.messageId(), clock.instant());
      }
      return DeliveryOutcome.failed(channel, address, attempt.provider(), attempt.errorMessage(), clock.instant());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Delivery of " + request.id() + " to " + recipient.id() + " failed", e);
      return DeliveryOutcome.failed(channel, address, null, e.getMessage(), clock.instant());
    }
  }

  private DeliveryOutcome unroutable(DispatchRequest request, Recipient recipient) {
    List<ChannelPreference> enabled = recipient.preferences().enabledChannelsByPriority();
    Channel preferred = enabled.get(0).channel();
    logger.log(Level.FINE, "Recipient {0} has no channel allowed by dispatch {1}",
        new Object[] {recipient.id(), request.id()});
    return DeliveryOutcome.failed(preferred, recipient.displayAddress(preferred), null,
        "No allowed channel for recipient", clock.instant());
  }

  private static boolean anyPrefersBatching(List<Recipient> recipients) {
    for (Recipient recipient : recipients) {
      if (recipient.preferences().frequency() == DeliveryFrequency.BATCHED) {
        return true;
      }
    }
    return false;
  }

  private void record(DispatchRequest request, List<DeliveryOutcome> outcomes) {
    if (recordWriter != null) {
      recordWriter.submit(request.id(), request, outcomes);
    }
  }

  private DispatchResult finish(DispatchResult result) {
    metrics.recordDispatchDurationMs(result.duration().toMillis());
    return result;
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
  }

  public BatchAggregator batchAggregator() {
    return batchAggregator;
  }

  public RuleRegistry rules() {
    return rules;
  }

  public ProviderRegistry providers() {
    return providers;
  }

  /**
   * Flushes pending batches, drains the record queue and stops owned threads.
   */
  @Override
  public void close() {
    batchAggregator.close();
    if (recordWriter != null) {
      recordWriter.close();
    }
    if (ownedDeliveryExecutor != null) {
      ownedDeliveryExecutor.shutdown();
      try {
        if (!ownedDeliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          ownedDeliveryExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        ownedDeliveryExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link DispatchEngine}.
   */
  public static final class Builder {
    private ProviderRegistry providers;
    private RuleRegistry rules;
    private ProviderFailover failover;
    private ChannelRoutes routes;
    private TemplateRenderer templateRenderer;
    private DeferredDispatchStore deferredStore;
    private DispatchRecordStore recordStore;
    private FallbackPolicy fallbackPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private int deliveryThreads = 8;
    private Executor deliveryExecutor;
    private Duration batchFlushInterval = Duration.ofMinutes(5);
    private int recordQueueCapacity = 1000;

    private Builder() {
    }

    /**
     * Sets the providers used for delivery, per channel.
     *
     * <p><b>Required.</b>
     */
    public Builder providers(ProviderRegistry providers) {
      this.providers = providers;
      return this;
    }

    /**
     * Optional. Defaults to an empty {@link RuleRegistry}.
     */
    public Builder rules(RuleRegistry rules) {
      this.rules = rules;
      return this;
    }

    /**
     * Optional. Defaults to a {@link ProviderFailover} that sleeps on the calling thread.
     */
    public Builder failover(ProviderFailover failover) {
      this.failover = failover;
      return this;
    }

    /**
     * Sets per-channel retry settings.
     *
     * <p>Optional. Defaults to {@link ChannelRoutes#defaults()}: 3 rounds, 1s base delay.
     */
    public Builder routes(ChannelRoutes routes) {
      this.routes = routes;
      return this;
    }

    /**
     * Optional. Defaults to {@link TemplateRenderer#NONE}.
     */
    public Builder templateRenderer(TemplateRenderer templateRenderer) {
      this.templateRenderer = templateRenderer;
      return this;
    }

    /**
     * Sets the store for requests scheduled for later. Required if any request (or rule)
     * sets {@code scheduledFor}.
     */
    public Builder deferredStore(DeferredDispatchStore deferredStore) {
      this.deferredStore = deferredStore;
      return this;
    }

    /**
     * Optional. By default nothing is recorded.
     */
    public Builder recordStore(DispatchRecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link FallbackPolicy#NONE}.
     */
    public Builder fallbackPolicy(FallbackPolicy fallbackPolicy) {
      this.fallbackPolicy = fallbackPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the size of the delivery pool. Ignored when {@link #deliveryExecutor} is set.
     *
     * <p>Optional. Defaults to {@code 8}. Must be &ge; 1.
     */
    public Builder deliveryThreads(int deliveryThreads) {
      this.deliveryThreads = deliveryThreads;
      return this;
    }

    /**
     * Runs deliveries on a caller-owned executor. The engine never shuts it down.
     */
    public Builder deliveryExecutor(Executor deliveryExecutor) {
      this.deliveryExecutor = deliveryExecutor;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     */
    public Builder batchFlushInterval(Duration batchFlushInterval) {
      this.batchFlushInterval = batchFlushInterval;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000} pending records.
     */
    public Builder recordQueueCapacity(int recordQueueCapacity) {
      this.recordQueueCapacity = recordQueueCapacity;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code providers} is null
     * @throws IllegalArgumentException if {@code deliveryThreads < 1} or the flush interval
     *                                  is not positive
     */
    public DispatchEngine build() {
      return new DispatchEngine(this);
    }
  }
}
