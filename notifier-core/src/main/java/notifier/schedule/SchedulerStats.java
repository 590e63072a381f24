package notifier.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the scheduler.
 *
 * @param running          whether the tick timer is active
 * @param totalSchedules   number of registered schedules
 * @param enabledSchedules number of enabled schedules
 * @param nextRun          earliest nextRun across enabled schedules, or {@code null}
 * @param tickInterval     configured tick interval
 */
public record SchedulerStats(
    boolean running,
    int totalSchedules,
    int enabledSchedules,
    Instant nextRun,
    Duration tickInterval) {
}
