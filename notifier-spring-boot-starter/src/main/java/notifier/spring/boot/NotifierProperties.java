package notifier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the notifier.
 *
 * @see NotifierAutoConfiguration
 */
@ConfigurationProperties(prefix = "notifier")
public class NotifierProperties {

  private final Scheduler scheduler = new Scheduler();
  private final Dispatch dispatch = new Dispatch();
  private final Retry retry = new Retry();
  private final Batch batch = new Batch();
  private final Metrics metrics = new Metrics();
  private final Jdbc jdbc = new Jdbc();

  public Scheduler getScheduler() {
    return scheduler;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public Retry getRetry() {
    return retry;
  }

  public Batch getBatch() {
    return batch;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public static class Scheduler {
    /**
     * Whether to start the scheduler loop. It is only created when a JobCreator bean exists.
     */
    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(60);
    private int fireThreads = 4;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getTickInterval() {
      return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
    }

    public int getFireThreads() {
      return fireThreads;
    }

    public void setFireThreads(int fireThreads) {
      this.fireThreads = fireThreads;
    }
  }

  public static class Dispatch {
    private int deliveryThreads = 8;
    /**
     * Chat channel that receives requests nobody was eligible for. Unset disables the fallback.
     */
    private String fallbackChatChannel;
    private int recordQueueCapacity = 1000;

    public int getDeliveryThreads() {
      return deliveryThreads;
    }

    public void setDeliveryThreads(int deliveryThreads) {
      this.deliveryThreads = deliveryThreads;
    }

    public String getFallbackChatChannel() {
      return fallbackChatChannel;
    }

    public void setFallbackChatChannel(String fallbackChatChannel) {
      this.fallbackChatChannel = fallbackChatChannel;
    }

    public int getRecordQueueCapacity() {
      return recordQueueCapacity;
    }

    public void setRecordQueueCapacity(int recordQueueCapacity) {
      this.recordQueueCapacity = recordQueueCapacity;
    }
  }

  public static class Retry {
    /**
     * Rounds over the provider list per delivery.
     */
    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(30);

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class Batch {
    private Duration flushInterval = Duration.ofMinutes(5);

    public Duration getFlushInterval() {
      return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "notifier";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Jdbc {
    private boolean enabled = true;
    /**
     * Create missing tables on startup.
     */
    private boolean initializeSchema = false;
    /**
     * Schema holding the notifier tables. Unset means the connection default.
     */
    private String schema;
    private String scheduleTable = "notifier_schedule";
    private String deferredTable = "notifier_deferred_dispatch";
    private String recordTable = "notifier_dispatch_record";
    private String outcomeTable = "notifier_delivery_outcome";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isInitializeSchema() {
      return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
    }

    public String getSchema() {
      return schema;
    }

    public void setSchema(String schema) {
      this.schema = schema;
    }

    public String getScheduleTable() {
      return scheduleTable;
    }

    public void setScheduleTable(String scheduleTable) {
      this.scheduleTable = scheduleTable;
    }

    public String getDeferredTable() {
      return deferredTable;
    }

    public void setDeferredTable(String deferredTable) {
      this.deferredTable = deferredTable;
    }

    public String getRecordTable() {
      return recordTable;
    }

    public void setRecordTable(String recordTable) {
      this.recordTable = recordTable;
    }

    public String getOutcomeTable() {
      return outcomeTable;
    }

    public void setOutcomeTable(String outcomeTable) {
      this.outcomeTable = outcomeTable;
    }
  }
}
