package notifier.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>When a schema is given, every connection is switched to it before use, so the
 * notifier tables can live outside the application's default schema.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;
  private final String schema;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, null);
  }

  /**
   * @param schema schema to select on each connection, or {@code null} for the default
   */
  public DataSourceConnectionProvider(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    if (schema != null && schema.isBlank()) {
      throw new IllegalArgumentException("schema must not be blank");
    }
    this.schema = schema;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection connection = dataSource.getConnection();
    if (schema == null) {
      return connection;
    }
    try {
      connection.setSchema(schema);
      return connection;
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  public String schema() {
    return schema;
  }
}
