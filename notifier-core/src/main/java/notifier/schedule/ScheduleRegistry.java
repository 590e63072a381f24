package notifier.schedule;

import com.github.f4b6a3.ulid.UlidCreator;
import notifier.InvalidScheduleException;
import notifier.ScheduleConfig;
import notifier.cron.CronEvaluator;
import notifier.cron.InvalidCronException;
import notifier.cron.NoUpcomingRunException;
import notifier.spi.ScheduleStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Authoritative in-memory view of all schedules, backed by a {@link ScheduleStore}.
 *
 * <p>Every mutation is written to the store first; only when the write succeeds does the
 * in-memory view change. A store failure propagates to the caller and leaves the view
 * untouched. Readers never block: the view is a {@link ConcurrentHashMap} of immutable
 * {@link ScheduleConfig} values, replaced wholesale on each change. Writers are
 * serialized so the store and the view agree on ordering.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see SchedulerLoop
 */
public final class ScheduleRegistry {
  private static final Logger logger = Logger.getLogger(ScheduleRegistry.class.getName());

  private final ScheduleStore store;
  private final CronEvaluator cronEvaluator;
  private final Clock clock;
  private final Map<String, ScheduleConfig> schedules = new ConcurrentHashMap<>();
  private final List<ScheduleListener> listeners = new CopyOnWriteArrayList<>();
  private final Object writeLock = new Object();

  private ScheduleRegistry(Builder builder) {
    this.store = builder.store != null ? builder.store : ScheduleStore.NONE;
    this.cronEvaluator = builder.cronEvaluator != null ? builder.cronEvaluator : new CronEvaluator();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.listeners.addAll(builder.listeners);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a new schedule.
   *
   * @return the stored schedule with its assigned id and computed nextRun
   * @throws InvalidScheduleException if the name is blank, the job type is empty, or the
   *                                  cron expression is invalid or never fires
   */
  public ScheduleConfig add(ScheduleDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    if (definition.name().isBlank()) {
      throw new InvalidScheduleException("Schedule name cannot be blank");
    }
    if (definition.job().jobType().isBlank()) {
      throw new InvalidScheduleException("Schedule job type cannot be blank");
    }
    Instant nextRun = definition.enabled()
        ? computeNextRun(definition.cron(), definition.name(), definition.timezone())
        : validated(definition.cron());
    ScheduleConfig schedule = new ScheduleConfig(
        UlidCreator.getMonotonicUlid().toString(),
        definition.name(),
        definition.cron(),
        definition.timezone(),
        definition.job(),
        definition.enabled(),
        definition.maxConcurrentRuns(),
        definition.createdBy(),
        null,
        nextRun);
    synchronized (writeLock) {
      store.saveSchedule(schedule);
      schedules.put(schedule.id(), schedule);
    }
    logger.log(Level.INFO, "Added schedule {0} ({1}) cron=''{2}'' nextRun={3}",
        new Object[] {schedule.id(), schedule.name(), schedule.cron(), schedule.nextRun()});
    notifyListeners(l -> l.onAdded(schedule));
    return schedule;
  }

  /**
   * Applies a partial update. nextRun is recomputed when the cron expression, timezone or
   * enabled flag changes; validation happens before anything is written.
   *
   * @return the updated schedule, or empty if no schedule has this id
   * @throws InvalidScheduleException if the new cron expression is invalid or never fires
   */
  public Optional<ScheduleConfig> update(String id, SchedulePatch patch) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(patch, "patch");
    ScheduleConfig previous;
    ScheduleConfig updated;
    synchronized (writeLock) {
      previous = schedules.get(id);
      if (previous == null) {
        return Optional.empty();
      }
      updated = patch.applyTo(previous);
      if (updated.name().isBlank()) {
        throw new InvalidScheduleException("Schedule name cannot be blank");
      }
      if (patch.affectsTiming(previous)) {
        Instant nextRun = updated.enabled()
            ? computeNextRun(updated.cron(), id, updated.timezone())
            : validated(updated.cron());
        updated = updated.withNextRun(nextRun);
      }
      store.saveSchedule(updated);
      schedules.put(id, updated);
    }
    ScheduleConfig current = updated;
    logger.log(Level.INFO, "Updated schedule {0} nextRun={1}", new Object[] {id, current.nextRun()});
    notifyListeners(l -> l.onUpdated(previous, current));
    return Optional.of(current);
  }

  /**
   * Removes a schedule. A fire already in progress completes; no further fires happen.
   *
   * @return {@code true} if a schedule was removed
   */
  public boolean remove(String id) {
    Objects.requireNonNull(id, "id");
    ScheduleConfig removed;
    synchronized (writeLock) {
      if (!schedules.containsKey(id)) {
        return false;
      }
      store.deleteSchedule(id);
      removed = schedules.remove(id);
    }
    logger.log(Level.INFO, "Removed schedule {0}", id);
    notifyListeners(l -> l.onRemoved(removed));
    return true;
  }

  public Optional<ScheduleConfig> get(String id) {
    return Optional.ofNullable(schedules.get(id));
  }

  /**
   * Returns a snapshot of all schedules, ordered by name.
   */
  public List<ScheduleConfig> listAll() {
    return sorted(schedules.values());
  }

  public List<ScheduleConfig> listByType(String jobType) {
    List<ScheduleConfig> result = new ArrayList<>();
    for (ScheduleConfig schedule : schedules.values()) {
      if (schedule.jobType().equals(jobType)) {
        result.add(schedule);
      }
    }
    return sorted(result);
  }

  public List<ScheduleConfig> listByOwner(String createdBy) {
    List<ScheduleConfig> result = new ArrayList<>();
    for (ScheduleConfig schedule : schedules.values()) {
      if (Objects.equals(schedule.createdBy(), createdBy)) {
        result.add(schedule);
      }
    }
    return sorted(result);
  }

  /**
   * Seeds the in-memory view from the store, replacing whatever it held.
   *
   * <p>nextRun is recomputed from the current time for every enabled schedule. A schedule
   * whose cron no longer parses or no longer has an upcoming run is loaded disabled, and
   * the disabled copy is written back.
   *
   * @return the number of schedules loaded
   */
  public int loadFromStore() {
    List<ScheduleConfig> loaded = store.loadAllSchedules();
    List<ScheduleConfig> disabled = new ArrayList<>();
    synchronized (writeLock) {
      schedules.clear();
      for (ScheduleConfig stored : loaded) {
        ScheduleConfig schedule = stored;
        if (stored.enabled()) {
          try {
            schedule = stored.withNextRun(cronEvaluator.next(stored.cron(), stored.timezone(), clock.instant()));
          } catch (InvalidCronException | NoUpcomingRunException e) {
            logger.log(Level.WARNING, "Loading schedule " + stored.id() + " disabled: " + e.getMessage());
            schedule = stored.disabled();
            store.saveSchedule(schedule);
            disabled.add(schedule);
          }
        } else if (stored.nextRun() != null) {
          schedule = stored.withNextRun(null);
        }
        schedules.put(schedule.id(), schedule);
      }
    }
    logger.log(Level.INFO, "Loaded {0} schedules from store", loaded.size());
    for (ScheduleConfig schedule : disabled) {
      notifyListeners(l -> l.onDisabled(schedule, "cron has no upcoming run"));
    }
    return loaded.size();
  }

  public void addListener(ScheduleListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ScheduleListener listener) {
    listeners.remove(listener);
  }

  /**
   * Records a completed fire. The next run is computed from the schedule as it is now,
   * so a cron or timezone changed while the job was being created is honored. Ignored if
   * the schedule was removed meanwhile.
   *
   * @throws NoUpcomingRunException if the current cron has no run after {@code after};
   *                                nothing is recorded in that case
   */
  Optional<ScheduleConfig> recordFire(String id, Instant lastRun, Instant after) {
    synchronized (writeLock) {
      ScheduleConfig current = schedules.get(id);
      if (current == null) {
        return Optional.empty();
      }
      ScheduleConfig updated = current.enabled()
          ? current.withRun(lastRun, cronEvaluator.next(current.cron(), current.timezone(), after))
          : current.withRun(lastRun, null);
      store.saveSchedule(updated);
      schedules.put(id, updated);
      return Optional.of(updated);
    }
  }

  /**
   * Disables a schedule and notifies listeners.
   */
  Optional<ScheduleConfig> disable(String id, Instant lastRun, String reason) {
    ScheduleConfig updated;
    synchronized (writeLock) {
      ScheduleConfig current = schedules.get(id);
      if (current == null) {
        return Optional.empty();
      }
      updated = (lastRun != null ? current.withRun(lastRun, null) : current).disabled();
      store.saveSchedule(updated);
      schedules.put(id, updated);
    }
    logger.log(Level.WARNING, "Disabled schedule {0}: {1}", new Object[] {id, reason});
    ScheduleConfig disabled = updated;
    notifyListeners(l -> l.onDisabled(disabled, reason));
    return Optional.of(updated);
  }

  Clock clock() {
    return clock;
  }

  void notifyListeners(Consumer<ScheduleListener> callback) {
    for (ScheduleListener listener : listeners) {
      try {
        callback.accept(listener);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Schedule listener failed", e);
      }
    }
  }

  private Instant computeNextRun(String cron, String label, ZoneId zone) {
    try {
      return cronEvaluator.next(cron, zone, clock.instant());
    } catch (InvalidCronException e) {
      throw new InvalidScheduleException(e.getMessage(), e);
    } catch (NoUpcomingRunException e) {
      throw new InvalidScheduleException("Schedule " + label + " would never fire: " + e.getMessage(), e);
    }
  }

  private Instant validated(String cron) {
    try {
      cronEvaluator.parse(cron);
      return null;
    } catch (InvalidCronException e) {
      throw new InvalidScheduleException(e.getMessage(), e);
    }
  }

  private static List<ScheduleConfig> sorted(Collection<ScheduleConfig> values) {
    List<ScheduleConfig> result = new ArrayList<>(values);
    result.sort(Comparator.comparing(ScheduleConfig::name).thenComparing(ScheduleConfig::id));
    return List.copyOf(result);
  }

  /**
   * Builder for {@link ScheduleRegistry}.
   */
  public static final class Builder {
    private ScheduleStore store;
    private CronEvaluator cronEvaluator;
    private Clock clock;
    private final List<ScheduleListener> listeners = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the durable store written before every in-memory change.
     *
     * <p>Optional. Defaults to {@link ScheduleStore#NONE}.
     */
    public Builder store(ScheduleStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Defaults to a new {@link CronEvaluator}.
     */
    public Builder cronEvaluator(CronEvaluator cronEvaluator) {
      this.cronEvaluator = cronEvaluator;
      return this;
    }

    /**
     * Sets the clock used to compute nextRun.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Adds a lifecycle listener. Optional; may be called repeatedly.
     */
    public Builder listener(ScheduleListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public ScheduleRegistry build() {
      return new ScheduleRegistry(this);
    }
  }
}
