package notifier.jdbc;

import notifier.Channel;
import notifier.DeliveryOutcome;
import notifier.DispatchRequest;
import notifier.spi.DispatchRecordStore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link DispatchRecordStore} writing one summary row per dispatch and one row per
 * delivery outcome, in a single transaction.
 */
public final class JdbcDispatchRecordStore implements DispatchRecordStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final JdbcTemplate.RowMapper<DeliveryOutcome> OUTCOME_ROW_MAPPER = rs -> new DeliveryOutcome(
      Channel.parse(rs.getString("channel")),
      rs.getString("recipient"),
      rs.getBoolean("success"),
      rs.getString("provider"),
      rs.getString("message_id"),
      rs.getString("error"),
      JdbcTemplate.instant(rs, "delivered_at"));

  private final ConnectionProvider connectionProvider;
  private final String recordTable;
  private final String outcomeTable;

  public JdbcDispatchRecordStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_DISPATCH_RECORDS, TableNames.DEFAULT_DELIVERY_OUTCOMES);
  }

  public JdbcDispatchRecordStore(ConnectionProvider connectionProvider, String recordTable, String outcomeTable) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.recordTable = TableNames.validate(recordTable);
    this.outcomeTable = TableNames.validate(outcomeTable);
  }

  @Override
  public void saveDispatchResult(String dispatchId, DispatchRequest request, List<DeliveryOutcome> outcomes) {
    Objects.requireNonNull(dispatchId, "dispatchId");
    int successful = 0;
    for (DeliveryOutcome outcome : outcomes) {
      if (outcome.success()) {
        successful++;
      }
    }
    int failed = outcomes.size() - successful;
    String recordSql = "INSERT INTO " + recordTable +
        " (dispatch_id, dispatch_type, category, severity, title, successful, failed, recorded_at)" +
        " VALUES (?,?,?,?,?,?,?,?)";
    String outcomeSql = "INSERT INTO " + outcomeTable +
        " (dispatch_id, seq, channel, recipient, success, provider, message_id, error, delivered_at)" +
        " VALUES (?,?,?,?,?,?,?,?,?)";
    int successCount = successful;
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, recordSql,
          dispatchId, request.type(), request.category().code(), request.severity().name(),
          request.title(), successCount, failed, Instant.now());
      int seq = 0;
      for (DeliveryOutcome outcome : outcomes) {
        JdbcTemplate.update(conn, outcomeSql,
            dispatchId, seq++, outcome.channel().code(), outcome.recipient(), outcome.success(),
            outcome.provider(), outcome.messageId(), truncateError(outcome.error()), outcome.timestamp());
      }
      return null;
    });
  }

  /**
   * Returns the recorded outcomes of one dispatch, in delivery order.
   */
  public List<DeliveryOutcome> findOutcomes(String dispatchId) {
    String sql = "SELECT channel, recipient, success, provider, message_id, error, delivered_at" +
        " FROM " + outcomeTable + " WHERE dispatch_id=? ORDER BY seq";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, OUTCOME_ROW_MAPPER, dispatchId));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
