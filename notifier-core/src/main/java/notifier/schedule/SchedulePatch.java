package notifier.schedule;

import notifier.JobDescriptor;
import notifier.ScheduleConfig;

import java.time.ZoneId;

/**
 * Partial update for {@link ScheduleRegistry#update}. Unset fields keep their current value.
 */
public final class SchedulePatch {
  private final String name;
  private final String cron;
  private final ZoneId timezone;
  private final JobDescriptor job;
  private final Boolean enabled;
  private final Integer maxConcurrentRuns;
  private final boolean clearMaxConcurrentRuns;

  private SchedulePatch(Builder builder) {
    this.name = builder.name;
    this.cron = builder.cron;
    this.timezone = builder.timezone;
    this.job = builder.job;
    this.enabled = builder.enabled;
    if (builder.maxConcurrentRuns != null && builder.maxConcurrentRuns < 1) {
      throw new IllegalArgumentException("maxConcurrentRuns must be >= 1, got: " + builder.maxConcurrentRuns);
    }
    this.maxConcurrentRuns = builder.maxConcurrentRuns;
    this.clearMaxConcurrentRuns = builder.clearMaxConcurrentRuns;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String cron() {
    return cron;
  }

  /**
   * Returns {@code true} if applying this patch changes when the schedule fires next.
   */
  boolean affectsTiming(ScheduleConfig current) {
    return (cron != null && !cron.equals(current.cron()))
        || (timezone != null && !timezone.equals(current.timezone()))
        || (enabled != null && enabled != current.enabled());
  }

  /**
   * Applies the patch to {@code current}, keeping lastRun and nextRun.
   */
  ScheduleConfig applyTo(ScheduleConfig current) {
    Integer cap = clearMaxConcurrentRuns ? null
        : maxConcurrentRuns != null ? maxConcurrentRuns : current.maxConcurrentRuns();
    return new ScheduleConfig(
        current.id(),
        name != null ? name : current.name(),
        cron != null ? cron : current.cron(),
        timezone != null ? timezone : current.timezone(),
        job != null ? job : current.job(),
        enabled != null ? enabled : current.enabled(),
        cap,
        current.createdBy(),
        current.lastRun(),
        current.nextRun());
  }

  /**
   * Builder for {@link SchedulePatch}.
   */
  public static final class Builder {
    private String name;
    private String cron;
    private ZoneId timezone;
    private JobDescriptor job;
    private Boolean enabled;
    private Integer maxConcurrentRuns;
    private boolean clearMaxConcurrentRuns;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder cron(String cron) {
      this.cron = cron;
      return this;
    }

    public Builder timezone(ZoneId timezone) {
      this.timezone = timezone;
      return this;
    }

    public Builder job(JobDescriptor job) {
      this.job = job;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder maxConcurrentRuns(int maxConcurrentRuns) {
      this.maxConcurrentRuns = maxConcurrentRuns;
      this.clearMaxConcurrentRuns = false;
      return this;
    }

    /** Removes the concurrency cap. */
    public Builder noConcurrencyCap() {
      this.maxConcurrentRuns = null;
      this.clearMaxConcurrentRuns = true;
      return this;
    }

    public SchedulePatch build() {
      return new SchedulePatch(this);
    }
  }
}
