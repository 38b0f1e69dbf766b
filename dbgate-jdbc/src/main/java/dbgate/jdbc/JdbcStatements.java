package dbgate.jdbc;

import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.QueryType;
import dbgate.model.Value;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Statement execution shared by connections, transactions and prepared statements.
 */
final class JdbcStatements {

  private JdbcStatements() {
  }

  static QueryResult query(JdbcDialect dialect, Connection connection, String sql, List<Value> params) {
    long start = System.nanoTime();
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      return query(dialect, ps, params, start);
    } catch (SQLException e) {
      throw JdbcErrors.translate("query failed", e);
    }
  }

  static QueryResult query(JdbcDialect dialect, PreparedStatement ps, List<Value> params, long start)
      throws SQLException {
    JdbcValues.bind(dialect, ps, params);
    try (ResultSet rs = ps.executeQuery()) {
      var columns = JdbcValues.columns(rs.getMetaData());
      var rows = JdbcValues.rows(dialect, rs);
      return new QueryResult(columns, rows, OptionalLong.of(rows.size()), since(start));
    }
  }

  static ExecuteResult execute(JdbcDialect dialect, Connection connection, String sql, List<Value> params) {
    long start = System.nanoTime();
    try (PreparedStatement ps = prepareCommand(connection, sql)) {
      return execute(dialect, ps, params, returnsKeys(sql), start);
    } catch (SQLException e) {
      throw JdbcErrors.translate("command failed", e);
    }
  }

  static ExecuteResult execute(JdbcDialect dialect, PreparedStatement ps, List<Value> params,
      boolean returnsKeys, long start) throws SQLException {
    JdbcValues.bind(dialect, ps, params);
    long rows = ps.executeLargeUpdate();
    Optional<Value> key = returnsKeys ? generatedKey(dialect, ps) : Optional.empty();
    return new ExecuteResult(rows, key, since(start));
  }

  /** Inserts ask the driver for generated keys. */
  static boolean returnsKeys(String sql) {
    return QueryType.classify(sql) == QueryType.INSERT;
  }

  static PreparedStatement prepareCommand(Connection connection, String sql) throws SQLException {
    if (returnsKeys(sql)) {
      return connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
    }
    return connection.prepareStatement(sql);
  }

  private static Optional<Value> generatedKey(JdbcDialect dialect, PreparedStatement ps)
      throws SQLException {
    try (ResultSet keys = ps.getGeneratedKeys()) {
      if (keys == null || !keys.next()) {
        return Optional.empty();
      }
      var meta = keys.getMetaData();
      Value key = JdbcValues.read(dialect, keys, 1, meta.getColumnType(1), meta.getColumnTypeName(1));
      return key.isNull() ? Optional.empty() : Optional.of(key);
    }
  }

  static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
