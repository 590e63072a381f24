package notifier.jdbc;

import notifier.Category;
import notifier.Channel;
import notifier.DispatchRequest;
import notifier.Recipient;
import notifier.Severity;
import notifier.spi.DeferredDispatchStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DeferredDispatchStore} backed by a JDBC table.
 *
 * <p>Rows start pending ({@code status=0}). An external poller reads due rows with
 * {@link #findDue}, resubmits each to the dispatch engine and then calls
 * {@link #markSubmitted}; a row that is never marked is returned again, so the poller
 * delivers at least once.
 *
 * <p>Template data is stored as a flat JSON object with every value converted to a string.
 */
public final class JdbcDeferredDispatchStore implements DeferredDispatchStore {
  static final int STATUS_PENDING = 0;
  static final int STATUS_SUBMITTED = 1;

  private static final String COLUMNS = "id, dispatch_type, category, severity, title, message, channels," +
      " template, template_data, metadata, recipient_ids, expires_at, scheduled_for";

  private static final JdbcTemplate.RowMapper<DeferredDispatch> ROW_MAPPER = rs -> {
    DispatchRequest.Builder request = DispatchRequest.builder(
            rs.getString("dispatch_type"),
            Category.parse(rs.getString("category")),
            Severity.parse(rs.getString("severity")))
        .id(rs.getString("id"))
        .title(rs.getString("title"))
        .message(rs.getString("message"))
        .template(rs.getString("template"))
        .templateData(JsonCodec.parseObject(rs.getString("template_data")))
        .metadata(JsonCodec.parseObject(rs.getString("metadata")))
        .expiresAt(JdbcTemplate.instant(rs, "expires_at"));
    String channels = rs.getString("channels");
    if (channels != null) {
      request.channels(decodeChannels(channels));
    }
    return new DeferredDispatch(request.build(), splitIds(rs.getString("recipient_ids")),
        JdbcTemplate.instant(rs, "scheduled_for"));
  };

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  public JdbcDeferredDispatchStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_DEFERRED_DISPATCHES);
  }

  public JdbcDeferredDispatchStore(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void saveScheduled(DispatchRequest request, List<Recipient> recipients, Instant scheduledFor) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(scheduledFor, "scheduledFor");
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ", status, created_at, submitted_at)" +
        " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,NULL)";
    List<String> ids = new ArrayList<>(recipients.size());
    for (Recipient recipient : recipients) {
      ids.add(recipient.id());
    }
    JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.update(conn, sql,
        request.id(), request.type(), request.category().code(), request.severity().name(),
        request.title(), request.message(), encodeChannels(request.channels()),
        request.template(), JsonCodec.toJson(stringify(request.templateData())),
        JsonCodec.toJson(request.metadata()), String.join(",", ids),
        request.expiresAt(), scheduledFor, STATUS_PENDING, Instant.now()));
  }

  /**
   * Returns pending rows whose scheduled time is at or before {@code now}, oldest first.
   */
  public List<DeferredDispatch> findDue(Instant now, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE status=? AND scheduled_for <= ? ORDER BY scheduled_for, id LIMIT ?";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, ROW_MAPPER, STATUS_PENDING, now, limit));
  }

  /**
   * Marks a row as handed to the dispatch engine.
   *
   * @return {@code false} if the row does not exist or was already submitted
   */
  public boolean markSubmitted(String id) {
    String sql = "UPDATE " + tableName + " SET status=?, submitted_at=? WHERE id=? AND status=?";
    int updated = JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.update(conn, sql, STATUS_SUBMITTED, Instant.now(), id, STATUS_PENDING));
    return updated > 0;
  }

  /**
   * Deletes a pending row, cancelling the deferred dispatch.
   *
   * @return {@code false} if the row does not exist or was already submitted
   */
  public boolean cancel(String id) {
    String sql = "DELETE FROM " + tableName + " WHERE id=? AND status=?";
    int deleted = JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.update(conn, sql, id, STATUS_PENDING));
    return deleted > 0;
  }

  private static String encodeChannels(Set<Channel> channels) {
    if (channels == null) {
      return null;
    }
    List<String> codes = new ArrayList<>(channels.size());
    for (Channel channel : channels) {
      codes.add(channel.code());
    }
    return String.join(",", codes);
  }

  private static Channel[] decodeChannels(String encoded) {
    if (encoded.isEmpty()) {
      return new Channel[0];
    }
    return Arrays.stream(encoded.split(",")).map(Channel::parse).toArray(Channel[]::new);
  }

  private static List<String> splitIds(String encoded) {
    if (encoded == null || encoded.isEmpty()) {
      return List.of();
    }
    return List.of(encoded.split(","));
  }

  private static Map<String, String> stringify(Map<String, Object> data) {
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : data.entrySet()) {
      if (entry.getValue() != null) {
        values.put(entry.getKey(), String.valueOf(entry.getValue()));
      }
    }
    return values;
  }
}
