package notifier.jdbc;

import java.util.List;
import java.util.Objects;

/**
 * Portable DDL for the notifier tables. Uses only types that H2, MySQL and PostgreSQL
 * all accept.
 */
public final class JdbcSchema {
  private final TableNames tables;

  public JdbcSchema(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /**
   * @return {@code CREATE TABLE IF NOT EXISTS} statements, in dependency order
   */
  public List<String> createStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tables.schedules() + " (" +
            "id VARCHAR(64) PRIMARY KEY," +
            "name VARCHAR(255) NOT NULL," +
            "cron VARCHAR(128) NOT NULL," +
            "timezone VARCHAR(64) NOT NULL," +
            "job_type VARCHAR(128) NOT NULL," +
            "job_params VARCHAR(4000)," +
            "enabled BOOLEAN NOT NULL," +
            "max_concurrent_runs INT," +
            "created_by VARCHAR(128)," +
            "last_run TIMESTAMP," +
            "next_run TIMESTAMP)",
        "CREATE TABLE IF NOT EXISTS " + tables.deferredDispatches() + " (" +
            "id VARCHAR(64) PRIMARY KEY," +
            "dispatch_type VARCHAR(128) NOT NULL," +
            "category VARCHAR(32) NOT NULL," +
            "severity VARCHAR(16) NOT NULL," +
            "title VARCHAR(1000)," +
            "message VARCHAR(4000)," +
            "channels VARCHAR(128)," +
            "template VARCHAR(128)," +
            "template_data VARCHAR(4000)," +
            "metadata VARCHAR(4000)," +
            "recipient_ids VARCHAR(4000)," +
            "expires_at TIMESTAMP," +
            "scheduled_for TIMESTAMP NOT NULL," +
            "status INT NOT NULL," +
            "created_at TIMESTAMP NOT NULL," +
            "submitted_at TIMESTAMP)",
        "CREATE TABLE IF NOT EXISTS " + tables.dispatchRecords() + " (" +
            "dispatch_id VARCHAR(64) PRIMARY KEY," +
            "dispatch_type VARCHAR(128) NOT NULL," +
            "category VARCHAR(32) NOT NULL," +
            "severity VARCHAR(16) NOT NULL," +
            "title VARCHAR(1000)," +
            "successful INT NOT NULL," +
            "failed INT NOT NULL," +
            "recorded_at TIMESTAMP NOT NULL)",
        "CREATE TABLE IF NOT EXISTS " + tables.deliveryOutcomes() + " (" +
            "dispatch_id VARCHAR(64) NOT NULL," +
            "seq INT NOT NULL," +
            "channel VARCHAR(16) NOT NULL," +
            "recipient VARCHAR(255) NOT NULL," +
            "success BOOLEAN NOT NULL," +
            "provider VARCHAR(128)," +
            "message_id VARCHAR(255)," +
            "error VARCHAR(4000)," +
            "delivered_at TIMESTAMP NOT NULL," +
            "PRIMARY KEY (dispatch_id, seq))");
  }

  /**
   * Creates any missing tables.
   */
  public void createTables(ConnectionProvider connectionProvider) {
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      for (String ddl : createStatements()) {
        JdbcTemplate.update(conn, ddl);
      }
      return null;
    });
  }
}
