package notifier.schedule;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), a schedule stays in flight until released.
 * When positive, an entry older than the TTL can be reclaimed, so a fire stuck in a hung
 * {@link notifier.spi.JobCreator} does not block its schedule forever.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inFlight = new ConcurrentHashMap<>();
  private final long ttlMs;

  public DefaultInFlightTracker() {
    this(0L);
  }

  /**
   * @param ttlMs time after which an unreleased entry may be reclaimed; {@code 0} disables expiry
   */
  public DefaultInFlightTracker(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0, got: " + ttlMs);
    }
    this.ttlMs = ttlMs;
  }

  @Override
  public boolean tryAcquire(String scheduleId) {
    long now = System.currentTimeMillis();
    Long existing = inFlight.putIfAbsent(scheduleId, now);
    if (existing == null) {
      return true;
    }
    if (ttlMs > 0 && now - existing > ttlMs) {
      return inFlight.replace(scheduleId, existing, now);
    }
    return false;
  }

  @Override
  public void release(String scheduleId) {
    inFlight.remove(scheduleId);
  }

  int size() {
    return inFlight.size();
  }
}
