package notifier.schedule;

import notifier.JobDescriptor;
import notifier.ScheduleConfig;
import notifier.cron.NoUpcomingRunException;
import notifier.spi.Job;
import notifier.spi.JobCreator;
import notifier.spi.MetricsExporter;
import notifier.spi.RunCounter;
import notifier.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-interval timer that fires due schedules from a {@link ScheduleRegistry}.
 *
 * <p>Each {@link #tick()} collects the enabled schedules whose nextRun has passed and
 * hands each one to the fire executor. A fire creates a job through the
 * {@link JobCreator}, then records lastRun and the nextRun computed from the current
 * time. A schedule is never fired while its previous fire is still running, and a
 * schedule with {@code maxConcurrentRuns} is skipped while its {@link RunCounter}
 * reports the cap reached.
 *
 * <p>Firing is at-least-once: if the process dies after job creation but before the
 * new nextRun is stored, the next start fires the schedule again. A failing job
 * creation leaves nextRun unchanged, so the schedule is retried on the next tick.
 *
 * <p>States: STOPPED (initial) and RUNNING, toggled by {@link #start()} and
 * {@link #stop()}. {@link #close()} stops the loop for good.
 *
 * <p>This class is thread-safe. Lifecycle methods are synchronized.
 */
public final class SchedulerLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SchedulerLoop.class.getName());

  static final String META_SCHEDULE_ID = "scheduleId";
  static final String META_SCHEDULE_NAME = "scheduleName";
  static final String META_SCHEDULED_AT = "scheduledAt";
  static final String META_TAGS = "tags";

  private final ScheduleRegistry registry;
  private final JobCreator jobCreator;
  private final RunCounter runCounter;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final Duration tickInterval;
  private final Executor fireExecutor;
  private final ExecutorService ownedFireExecutor;

  private ScheduledExecutorService timer;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private SchedulerLoop(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.jobCreator = Objects.requireNonNull(builder.jobCreator, "jobCreator");
    this.runCounter = builder.runCounter != null ? builder.runCounter : RunCounter.NONE;
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    Duration tickInterval = builder.tickInterval;
    if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
    this.tickInterval = tickInterval;

    if (builder.fireExecutor != null) {
      this.fireExecutor = builder.fireExecutor;
      this.ownedFireExecutor = null;
    } else {
      if (builder.fireThreads < 1) {
        throw new IllegalArgumentException("fireThreads must be >= 1");
      }
      this.ownedFireExecutor = Executors.newFixedThreadPool(builder.fireThreads,
          new DaemonThreadFactory("notifier-scheduler-fire-"));
      this.fireExecutor = ownedFireExecutor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the tick timer; the first tick runs immediately. No-op if already running.
   *
   * @throws IllegalStateException if the loop has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SchedulerLoop has been closed");
    }
    if (tickTask != null) {
      return;
    }
    timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("notifier-scheduler-"));
    long intervalMs = tickInterval.toMillis();
    tickTask = timer.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Scheduler started, tick interval {0}", tickInterval);
  }

  /**
   * Stops the tick timer. Fires already submitted run to completion. No-op if stopped.
   */
  public synchronized void stop() {
    if (tickTask == null) {
      return;
    }
    tickTask.cancel(false);
    tickTask = null;
    timer.shutdownNow();
    timer = null;
    logger.info("Scheduler stopped");
  }

  public boolean isRunning() {
    return tickTask != null;
  }

  /**
   * Runs one scheduling pass. Called by the timer, but may also be invoked directly for testing.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      Instant now = registry.clock().instant();
      for (ScheduleConfig schedule : registry.listAll()) {
        if (schedule.isDue(now)) {
          submitFire(schedule);
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduler tick failed", t);
    }
  }

  private void submitFire(ScheduleConfig schedule) {
    if (!inFlightTracker.tryAcquire(schedule.id())) {
      logger.log(Level.FINE, "Schedule {0} still firing, skipped this tick", schedule.id());
      return;
    }
    boolean submitted = false;
    try {
      if (atConcurrencyCap(schedule)) {
        return;
      }
      fireExecutor.execute(() -> {
        try {
          fire(schedule);
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Fire of schedule " + schedule.id() + " failed", t);
        } finally {
          inFlightTracker.release(schedule.id());
        }
      });
      submitted = true;
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Fire executor rejected schedule " + schedule.id(), e);
    } finally {
      if (!submitted) {
        inFlightTracker.release(schedule.id());
      }
    }
  }

  private boolean atConcurrencyCap(ScheduleConfig schedule) {
    if (!schedule.hasConcurrencyCap()) {
      return false;
    }
    int running;
    try {
      running = runCounter.countRunning(schedule.jobType(), schedule.id());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Run count for schedule " + schedule.id() + " failed, assuming 0", e);
      running = 0;
    }
    if (running < schedule.maxConcurrentRuns()) {
      return false;
    }
    String reason = "max concurrent runs (" + schedule.maxConcurrentRuns() + ") reached";
    logger.log(Level.WARNING, "Skipping schedule {0} ({1}): {2}",
        new Object[] {schedule.id(), schedule.name(), reason});
    metrics.incrementScheduleSkipped();
    registry.notifyListeners(l -> l.onSkipped(schedule, reason));
    return true;
  }

  private void fire(ScheduleConfig schedule) {
    try {
      createAndRecord(schedule);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Job creation for schedule " + schedule.id() + " (" + schedule.name() + ") failed", e);
      metrics.incrementScheduleFailed();
      registry.notifyListeners(l -> l.onFailed(schedule, e));
    }
  }

  /**
   * Creates the schedule's job, then advances it. Job creation failures propagate.
   */
  private Job createAndRecord(ScheduleConfig schedule) {
    Instant firedAt = registry.clock().instant();
    Job job = jobCreator.createJob(describe(schedule, firedAt));
    metrics.incrementScheduleFired();
    logger.log(Level.INFO, "Schedule {0} ({1}) created job {2}",
        new Object[] {schedule.id(), schedule.name(), job.id()});

    Instant now = registry.clock().instant();
    Optional<ScheduleConfig> updated;
    try {
      updated = registry.recordFire(schedule.id(), firedAt, now);
    } catch (NoUpcomingRunException e) {
      updated = registry.disable(schedule.id(), firedAt, "cron has no upcoming run");
    }
    updated.ifPresent(current -> registry.notifyListeners(l -> l.onFired(current, job)));
    return job;
  }

  /**
   * Fires a schedule immediately, regardless of its nextRun or enabled flag.
   *
   * <p>Job creation failures propagate to the caller.
   *
   * @return the created job, or empty if the schedule is unknown or is already firing
   */
  public Optional<Job> trigger(String scheduleId) {
    Optional<ScheduleConfig> schedule = registry.get(scheduleId);
    if (schedule.isEmpty()) {
      return Optional.empty();
    }
    if (!inFlightTracker.tryAcquire(scheduleId)) {
      logger.log(Level.WARNING, "Manual trigger of schedule {0} ignored: already firing", scheduleId);
      return Optional.empty();
    }
    try {
      logger.log(Level.INFO, "Manually triggering schedule {0}", scheduleId);
      return Optional.of(createAndRecord(schedule.get()));
    } finally {
      inFlightTracker.release(scheduleId);
    }
  }

  public SchedulerStats stats() {
    List<ScheduleConfig> all = registry.listAll();
    int enabled = 0;
    Instant earliest = null;
    for (ScheduleConfig schedule : all) {
      if (!schedule.enabled()) {
        continue;
      }
      enabled++;
      if (schedule.nextRun() != null && (earliest == null || schedule.nextRun().isBefore(earliest))) {
        earliest = schedule.nextRun();
      }
    }
    return new SchedulerStats(isRunning(), all.size(), enabled, earliest, tickInterval);
  }

  private static JobDescriptor describe(ScheduleConfig schedule, Instant firedAt) {
    Map<String, String> meta = new LinkedHashMap<>();
    meta.put(META_SCHEDULE_ID, schedule.id());
    meta.put(META_SCHEDULE_NAME, schedule.name());
    meta.put(META_SCHEDULED_AT, firedAt.toString());
    List<String> tags = new ArrayList<>();
    tags.add("scheduled");
    tags.add("schedule:" + schedule.id());
    meta.put(META_TAGS, String.join(",", tags));
    return schedule.job().withParams(meta);
  }

  /**
   * Stops the timer and shuts down the fire executor if this loop created it.
   */
  @Override
  public synchronized void close() {
    closed = true;
    stop();
    if (ownedFireExecutor != null) {
      ownedFireExecutor.shutdown();
      try {
        if (!ownedFireExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          ownedFireExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        ownedFireExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link SchedulerLoop}.
   */
  public static final class Builder {
    private ScheduleRegistry registry;
    private JobCreator jobCreator;
    private RunCounter runCounter;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Duration tickInterval = Duration.ofSeconds(60);
    private int fireThreads = 4;
    private Executor fireExecutor;

    private Builder() {
    }

    /**
     * Sets the registry whose schedules are fired.
     *
     * <p><b>Required.</b>
     */
    public Builder registry(ScheduleRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the job creator called on every fire.
     *
     * <p><b>Required.</b>
     */
    public Builder jobCreator(JobCreator jobCreator) {
      this.jobCreator = jobCreator;
      return this;
    }

    /**
     * Sets the counter consulted for schedules with a concurrency cap.
     *
     * <p>Optional. Defaults to {@link RunCounter#NONE}.
     */
    public Builder runCounter(RunCounter runCounter) {
      this.runCounter = runCounter;
      return this;
    }

    /**
     * Optional. Defaults to a {@link DefaultInFlightTracker} without expiry.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
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
     * Sets the delay between ticks.
     *
     * <p>Optional. Defaults to 60 seconds. Must be positive.
     */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    /**
     * Sets the size of the fire pool created by the loop. Ignored when
     * {@link #fireExecutor} is set.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     */
    public Builder fireThreads(int fireThreads) {
      this.fireThreads = fireThreads;
      return this;
    }

    /**
     * Runs fires on a caller-owned executor instead of an internal pool. The loop never
     * shuts it down.
     */
    public Builder fireExecutor(Executor fireExecutor) {
      this.fireExecutor = fireExecutor;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code registry} or {@code jobCreator} is null
     * @throws IllegalArgumentException if {@code tickInterval} is not positive or
     *                                  {@code fireThreads < 1}
     */
    public SchedulerLoop build() {
      return new SchedulerLoop(this);
    }
  }
}
