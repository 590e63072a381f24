package notifier;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A named cron expression bound to a job descriptor.
 *
 * <p>Instances are immutable; the registry replaces them wholesale on every change.
 * {@code nextRun} is the earliest instant after the last evaluation that satisfies
 * {@code cron} in {@code timezone}, or {@code null} when the schedule is disabled.
 *
 * @param id                unique id assigned by the registry
 * @param name              human-readable name
 * @param cron              five-field cron expression
 * @param timezone          zone the cron expression is evaluated in
 * @param job               job created on each fire
 * @param enabled           whether the scheduler fires this schedule
 * @param maxConcurrentRuns cap on concurrently running jobs, or {@code null} for no cap
 * @param createdBy         owner id, or {@code null} for system schedules
 * @param lastRun           last fire time, or {@code null}
 * @param nextRun           next fire time, or {@code null} when disabled
 */
public record ScheduleConfig(
    String id,
    String name,
    String cron,
    ZoneId timezone,
    JobDescriptor job,
    boolean enabled,
    Integer maxConcurrentRuns,
    String createdBy,
    Instant lastRun,
    Instant nextRun) {

  public ScheduleConfig {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(cron, "cron");
    Objects.requireNonNull(timezone, "timezone");
    Objects.requireNonNull(job, "job");
  }

  public String jobType() {
    return job.jobType();
  }

  public boolean hasConcurrencyCap() {
    return maxConcurrentRuns != null && maxConcurrentRuns > 0;
  }

  public boolean isDue(Instant now) {
    return enabled && nextRun != null && !nextRun.isAfter(now);
  }

  public ScheduleConfig withRun(Instant lastRun, Instant nextRun) {
    return new ScheduleConfig(id, name, cron, timezone, job, enabled, maxConcurrentRuns,
        createdBy, lastRun, nextRun);
  }

  public ScheduleConfig withNextRun(Instant nextRun) {
    return withRun(lastRun, nextRun);
  }

  public ScheduleConfig disabled() {
    return new ScheduleConfig(id, name, cron, timezone, job, false, maxConcurrentRuns,
        createdBy, lastRun, null);
  }
}
