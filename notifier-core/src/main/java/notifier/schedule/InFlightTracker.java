package notifier.schedule;

/**
 * Tracks schedules whose fire action is currently executing, so a slow fire is never
 * overlapped by the next tick.
 */
public interface InFlightTracker {
  boolean tryAcquire(String scheduleId);

  void release(String scheduleId);
}
