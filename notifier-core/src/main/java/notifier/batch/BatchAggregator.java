package notifier.batch;

import notifier.Channel;
import notifier.DispatchRequest;
import notifier.DispatchResult;
import notifier.Recipient;
import notifier.Severity;
import notifier.spi.MetricsExporter;
import notifier.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects non-critical requests for recipients who prefer batched delivery and turns
 * them into one digest per {@link BatchKey} on every flush.
 *
 * <p>A digest is titled {@code "<n> <category> notifications"}, lists the queued titles
 * as bullet lines, uses the {@value #DIGEST_TEMPLATE} template with the queued entries as
 * template data, goes to the union of the queued recipients (de-duplicated by id) and
 * carries the highest queued severity. If the {@link BatchSink} throws, the entries stay
 * queued for the next flush. Entries whose request has a {@code scheduledFor} in the
 * future are held until a flush at or after that instant.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} begins the periodic flush;
 * {@link #close()} stops it and flushes whatever is left.
 *
 * <p>This class is thread-safe.
 */
public final class BatchAggregator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchAggregator.class.getName());

  public static final String DIGEST_TEMPLATE = "batch_digest";
  public static final String DATA_NOTIFICATIONS = "notifications";
  public static final String DATA_COUNT = "count";
  public static final String META_BATCH_KEY = "batchKey";

  private final BatchSink sink;
  private final Duration flushInterval;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Map<BatchKey, List<Entry>> pending = new LinkedHashMap<>();

  private ScheduledExecutorService timer;
  private volatile ScheduledFuture<?> flushTask;
  private volatile boolean closed;

  private BatchAggregator(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    Duration flushInterval = builder.flushInterval;
    if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    this.flushInterval = flushInterval;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * A queued request together with the recipients it was queued for.
   *
   * @param request    the request
   * @param recipients its eligible recipients
   * @param queuedAt   enqueue time
   */
  public record Entry(DispatchRequest request, List<Recipient> recipients, Instant queuedAt) {
    public Entry {
      Objects.requireNonNull(request, "request");
      recipients = List.copyOf(recipients);
    }

    /** Whether the request may go out at {@code now}. */
    public boolean isDueAt(Instant now) {
      return !request.isScheduledAfter(now);
    }
  }

  /**
   * Starts the periodic flush. No-op if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BatchAggregator has been closed");
    }
    if (flushTask != null) {
      return;
    }
    timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("notifier-batch-"));
    long intervalMs = flushInterval.toMillis();
    flushTask = timer.scheduleWithFixedDelay(this::flushQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Queues a request.
   *
   * @throws IllegalArgumentException if the request is CRITICAL
   * @throws IllegalStateException    if the aggregator has been closed
   */
  public void enqueue(DispatchRequest request, List<Recipient> recipients) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(recipients, "recipients");
    if (request.isCritical()) {
      throw new IllegalArgumentException("CRITICAL requests are never batched: " + request.id());
    }
    if (closed) {
      throw new IllegalStateException("BatchAggregator has been closed");
    }
    BatchKey key = new BatchKey(request.category(), request.type());
    int size;
    synchronized (pending) {
      pending.computeIfAbsent(key, ignored -> new ArrayList<>()).add(new Entry(request, recipients, clock.instant()));
      size = countLocked();
    }
    logger.log(Level.FINE, "Queued dispatch {0} under batch {1}", new Object[] {request.id(), key});
    metrics.recordBatchPending(size);
  }

  /**
   * Delivers one digest per pending batch key, built from the entries that are due.
   * Called by the timer, but may also be invoked directly.
   *
   * @return the sink's results, one per digest delivered
   */
  public List<DispatchResult> flush() {
    Instant now = clock.instant();
    Map<BatchKey, List<Entry>> drained = new LinkedHashMap<>();
    synchronized (pending) {
      Iterator<Map.Entry<BatchKey, List<Entry>>> batches = pending.entrySet().iterator();
      while (batches.hasNext()) {
        Map.Entry<BatchKey, List<Entry>> batch = batches.next();
        List<Entry> due = new ArrayList<>();
        List<Entry> held = new ArrayList<>();
        for (Entry entry : batch.getValue()) {
          if (entry.isDueAt(now)) {
            due.add(entry);
          } else {
            held.add(entry);
          }
        }
        if (!due.isEmpty()) {
          drained.put(batch.getKey(), due);
        }
        if (held.isEmpty()) {
          batches.remove();
        } else {
          batch.setValue(held);
        }
      }
    }
    if (drained.isEmpty()) {
      return List.of();
    }
    List<DispatchResult> results = new ArrayList<>();
    for (Map.Entry<BatchKey, List<Entry>> batch : drained.entrySet()) {
      DispatchRequest digest = digest(batch.getKey(), batch.getValue());
      try {
        results.add(sink.deliver(digest));
        logger.log(Level.INFO, "Flushed batch {0} ({1} notifications)",
            new Object[] {batch.getKey(), batch.getValue().size()});
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to deliver batch " + batch.getKey() + ", keeping it queued", e);
        requeue(batch.getKey(), batch.getValue());
      }
    }
    metrics.recordBatchPending(pendingCount());
    return results;
  }

  private void flushQuietly() {
    try {
      flush();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Batch flush failed", t);
    }
  }

  private void requeue(BatchKey key, List<Entry> entries) {
    synchronized (pending) {
      List<Entry> current = pending.get(key);
      List<Entry> merged = new ArrayList<>(entries);
      if (current != null) {
        merged.addAll(current);
      }
      pending.put(key, merged);
    }
  }

  static DispatchRequest digest(BatchKey key, List<Entry> entries) {
    Severity severity = Severity.LOW;
    Map<String, Recipient> recipients = new LinkedHashMap<>();
    Set<Channel> channels = EnumSet.noneOf(Channel.class);
    boolean unrestricted = false;
    List<String> lines = new ArrayList<>();
    List<Map<String, Object>> notifications = new ArrayList<>();

    for (Entry entry : entries) {
      DispatchRequest request = entry.request();
      if (request.severity().compareTo(severity) > 0) {
        severity = request.severity();
      }
      for (Recipient recipient : entry.recipients()) {
        recipients.putIfAbsent(recipient.id(), recipient);
      }
      if (request.channels() == null) {
        unrestricted = true;
      } else {
        channels.addAll(request.channels());
      }
      lines.add("• " + request.title());
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("id", request.id());
      item.put("title", request.title());
      item.put("message", request.message());
      item.put("severity", request.severity().name());
      notifications.add(item);
    }

    DispatchRequest.Builder digest = DispatchRequest.builder(key.type(), key.category(), severity)
        .title(entries.size() + " " + key.category().code() + " notifications")
        .message(String.join("\n", lines))
        .recipients(new ArrayList<>(recipients.values()))
        .template(DIGEST_TEMPLATE)
        .templateValue(DATA_NOTIFICATIONS, notifications)
        .templateValue(DATA_COUNT, entries.size())
        .metadata(META_BATCH_KEY, key.toString());
    if (!unrestricted) {
      digest.channels(channels.toArray(new Channel[0]));
    }
    return digest.build();
  }

  /** Number of requests waiting across all keys. */
  public int pendingCount() {
    synchronized (pending) {
      return countLocked();
    }
  }

  /** Snapshot of the queued entries per key. */
  public Map<BatchKey, List<Entry>> pending() {
    synchronized (pending) {
      Map<BatchKey, List<Entry>> copy = new LinkedHashMap<>();
      pending.forEach((key, entries) -> copy.put(key, List.copyOf(entries)));
      return copy;
    }
  }

  private int countLocked() {
    int count = 0;
    for (List<Entry> entries : pending.values()) {
      count += entries.size();
    }
    return count;
  }

  /**
   * Stops the flush timer and flushes every remaining due batch once.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (flushTask != null) {
      flushTask.cancel(false);
      flushTask = null;
    }
    if (timer != null) {
      timer.shutdownNow();
      try {
        timer.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    flushQuietly();
    int held = pendingCount();
    if (held > 0) {
      logger.log(Level.WARNING, "Closing with {0} batched notifications scheduled for later, not delivered", held);
    }
  }

  /**
   * Builder for {@link BatchAggregator}.
   */
  public static final class Builder {
    private BatchSink sink;
    private Duration flushInterval = Duration.ofMinutes(5);
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets where digests go.
     *
     * <p><b>Required.</b>
     */
    public Builder sink(BatchSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes. Must be positive.
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
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

    public BatchAggregator build() {
      return new BatchAggregator(this);
    }
  }
}
