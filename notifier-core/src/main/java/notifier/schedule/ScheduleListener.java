package notifier.schedule;

import notifier.ScheduleConfig;
import notifier.spi.Job;

/**
 * Observer of schedule lifecycle transitions. Every method has an empty default.
 *
 * <p>Callbacks run on the thread that caused the transition and must not block.
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface ScheduleListener {

  default void onAdded(ScheduleConfig schedule) {
  }

  default void onUpdated(ScheduleConfig previous, ScheduleConfig current) {
  }

  default void onRemoved(ScheduleConfig schedule) {
  }

  /**
   * A job was created; {@code schedule} already carries the new lastRun and nextRun.
   */
  default void onFired(ScheduleConfig schedule, Job job) {
  }

  /**
   * A due schedule was not fired because it reached its concurrency cap.
   */
  default void onSkipped(ScheduleConfig schedule, String reason) {
  }

  /**
   * Job creation failed; the schedule will be retried on the next tick.
   */
  default void onFailed(ScheduleConfig schedule, Throwable error) {
  }

  /**
   * The registry disabled the schedule, e.g. because its cron has no upcoming run.
   */
  default void onDisabled(ScheduleConfig schedule, String reason) {
  }
}
