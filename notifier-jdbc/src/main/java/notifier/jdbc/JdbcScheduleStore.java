package notifier.jdbc;

import notifier.JobDescriptor;
import notifier.ScheduleConfig;
import notifier.spi.ScheduleStore;

import java.sql.Connection;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * {@link ScheduleStore} backed by a single JDBC table.
 *
 * <p>Saves are an UPDATE followed by an INSERT when no row matched, inside one
 * transaction, so the store works on any database without dialect-specific upserts.
 * Job parameters are stored as a flat JSON object.
 */
public final class JdbcScheduleStore implements ScheduleStore {
  private static final String COLUMNS =
      "id, name, cron, timezone, job_type, job_params, enabled, max_concurrent_runs, created_by, last_run, next_run";

  private static final JdbcTemplate.RowMapper<ScheduleConfig> SCHEDULE_ROW_MAPPER = rs -> {
    int maxRuns = rs.getInt("max_concurrent_runs");
    Integer maxConcurrentRuns = rs.wasNull() ? null : maxRuns;
    return new ScheduleConfig(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("cron"),
        ZoneId.of(rs.getString("timezone")),
        new JobDescriptor(rs.getString("job_type"), JsonCodec.parseObject(rs.getString("job_params"))),
        rs.getBoolean("enabled"),
        maxConcurrentRuns,
        rs.getString("created_by"),
        JdbcTemplate.instant(rs, "last_run"),
        JdbcTemplate.instant(rs, "next_run"));
  };

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  public JdbcScheduleStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_SCHEDULES);
  }

  public JdbcScheduleStore(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void saveSchedule(ScheduleConfig schedule) {
    Objects.requireNonNull(schedule, "schedule");
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      if (update(conn, schedule) == 0) {
        insert(conn, schedule);
      }
      return null;
    });
  }

  @Override
  public void deleteSchedule(String id) {
    String sql = "DELETE FROM " + tableName + " WHERE id=?";
    JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.update(conn, sql, id));
  }

  @Override
  public List<ScheduleConfig> loadAllSchedules() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY name, id";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER));
  }

  private int update(Connection conn, ScheduleConfig s) {
    String sql = "UPDATE " + tableName + " SET name=?, cron=?, timezone=?, job_type=?, job_params=?," +
        " enabled=?, max_concurrent_runs=?, created_by=?, last_run=?, next_run=? WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        s.name(), s.cron(), s.timezone().getId(), s.jobType(), JsonCodec.toJson(s.job().params()),
        s.enabled(), s.maxConcurrentRuns(), s.createdBy(), s.lastRun(), s.nextRun(), s.id());
  }

  private void insert(Connection conn, ScheduleConfig s) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        s.id(), s.name(), s.cron(), s.timezone().getId(), s.jobType(), JsonCodec.toJson(s.job().params()),
        s.enabled(), s.maxConcurrentRuns(), s.createdBy(), s.lastRun(), s.nextRun());
  }
}
