package notifier.schedule;

import notifier.JobDescriptor;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;

/**
 * Input to {@link ScheduleRegistry#add}: everything about a schedule except the fields
 * the registry assigns (id, lastRun, nextRun).
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ScheduleDefinition {
  private final String name;
  private final String cron;
  private final ZoneId timezone;
  private final JobDescriptor job;
  private final boolean enabled;
  private final Integer maxConcurrentRuns;
  private final String createdBy;

  private ScheduleDefinition(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.cron = Objects.requireNonNull(builder.cron, "cron");
    this.job = Objects.requireNonNull(builder.job, "job");
    this.timezone = builder.timezone == null ? ZoneOffset.UTC : builder.timezone;
    this.enabled = builder.enabled;
    if (builder.maxConcurrentRuns != null && builder.maxConcurrentRuns < 1) {
      throw new IllegalArgumentException("maxConcurrentRuns must be >= 1, got: " + builder.maxConcurrentRuns);
    }
    this.maxConcurrentRuns = builder.maxConcurrentRuns;
    this.createdBy = builder.createdBy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return name;
  }

  public String cron() {
    return cron;
  }

  public ZoneId timezone() {
    return timezone;
  }

  public JobDescriptor job() {
    return job;
  }

  public boolean enabled() {
    return enabled;
  }

  public Integer maxConcurrentRuns() {
    return maxConcurrentRuns;
  }

  public String createdBy() {
    return createdBy;
  }

  /**
   * Builder for {@link ScheduleDefinition}.
   */
  public static final class Builder {
    private String name;
    private String cron;
    private ZoneId timezone;
    private JobDescriptor job;
    private boolean enabled = true;
    private Integer maxConcurrentRuns;
    private String createdBy;

    private Builder() {
    }

    /**
     * <b>Required.</b> Must not be blank.
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * <b>Required.</b> Five-field cron expression.
     */
    public Builder cron(String cron) {
      this.cron = cron;
      return this;
    }

    /**
     * Optional. Defaults to UTC.
     */
    public Builder timezone(ZoneId timezone) {
      this.timezone = timezone;
      return this;
    }

    /**
     * <b>Required.</b> The job created on every fire.
     */
    public Builder job(JobDescriptor job) {
      this.job = job;
      return this;
    }

    public Builder job(String jobType, Map<String, String> params) {
      return job(new JobDescriptor(jobType, params));
    }

    /**
     * Optional. Defaults to {@code true}.
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Optional. No cap by default. Must be &ge; 1 when set.
     */
    public Builder maxConcurrentRuns(Integer maxConcurrentRuns) {
      this.maxConcurrentRuns = maxConcurrentRuns;
      return this;
    }

    /**
     * Optional owner id.
     */
    public Builder createdBy(String createdBy) {
      this.createdBy = createdBy;
      return this;
    }

    public ScheduleDefinition build() {
      return new ScheduleDefinition(this);
    }
  }
}
