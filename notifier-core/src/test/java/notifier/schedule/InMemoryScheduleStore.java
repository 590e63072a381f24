package notifier.schedule;

import notifier.ScheduleConfig;
import notifier.spi.ScheduleStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryScheduleStore implements ScheduleStore {
  final Map<String, ScheduleConfig> rows = new ConcurrentHashMap<>();
  volatile boolean failWrites;
  int saves;

  @Override
  public void saveSchedule(ScheduleConfig schedule) {
    if (failWrites) {
      throw new IllegalStateException("store unavailable");
    }
    saves++;
    rows.put(schedule.id(), schedule);
  }

  @Override
  public void deleteSchedule(String id) {
    if (failWrites) {
      throw new IllegalStateException("store unavailable");
    }
    rows.remove(id);
  }

  @Override
  public List<ScheduleConfig> loadAllSchedules() {
    return new ArrayList<>(rows.values());
  }
}
