package notifier.spi;

import notifier.ScheduleConfig;

import java.util.List;

/**
 * Durable storage for schedules.
 *
 * <p>The registry calls these methods synchronously, before changing its in-memory
 * view. Implementations signal failure with a runtime exception, which aborts the
 * mutation.
 */
public interface ScheduleStore {

  /** Store that keeps nothing. */
  ScheduleStore NONE = new ScheduleStore() {
    @Override
    public void saveSchedule(ScheduleConfig schedule) {
    }

    @Override
    public void deleteSchedule(String id) {
    }

    @Override
    public List<ScheduleConfig> loadAllSchedules() {
      return List.of();
    }
  };

  /** Inserts or replaces a schedule. */
  void saveSchedule(ScheduleConfig schedule);

  void deleteSchedule(String id);

  List<ScheduleConfig> loadAllSchedules();
}
