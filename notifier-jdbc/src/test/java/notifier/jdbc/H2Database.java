package notifier.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Fresh in-memory H2 database with the notifier tables created.
 */
final class H2Database {
  final JdbcDataSource dataSource;
  final ConnectionProvider connections;

  H2Database() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    connections = new DataSourceConnectionProvider(dataSource);
    new JdbcSchema(TableNames.defaults()).createTables(connections);
  }

  int count(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  void execute(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }
}
