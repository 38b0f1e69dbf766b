package dbgate.jdbc;

import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.Value;
import dbgate.spi.DatabasePreparedStatement;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

final class JdbcPreparedStatement implements DatabasePreparedStatement {
  private static final Logger logger = Logger.getLogger(JdbcPreparedStatement.class.getName());

  private final JdbcConnection owner;
  private final JdbcDialect dialect;
  private final String statement;
  private final PreparedStatement ps;
  private final int parameterCount;

  JdbcPreparedStatement(JdbcConnection owner, JdbcDialect dialect, String statement,
      PreparedStatement ps) throws SQLException {
    this.owner = owner;
    this.dialect = dialect;
    this.statement = statement;
    this.ps = ps;
    this.parameterCount = dialect.parameterCount(ps, statement);
  }

  @Override
  public String statement() {
    return statement;
  }

  @Override
  public int parameterCount() {
    return parameterCount;
  }

  @Override
  public QueryResult query(List<Value> params) {
    owner.touch();
    long start = System.nanoTime();
    try {
      ps.clearParameters();
      return JdbcStatements.query(dialect, ps, params, start);
    } catch (SQLException e) {
      throw JdbcErrors.translate("prepared query failed", e);
    }
  }

  @Override
  public ExecuteResult execute(List<Value> params) {
    owner.touch();
    long start = System.nanoTime();
    try {
      ps.clearParameters();
      return JdbcStatements.execute(dialect, ps, params, JdbcStatements.returnsKeys(statement), start);
    } catch (SQLException e) {
      throw JdbcErrors.translate("prepared command failed", e);
    }
  }

  @Override
  public void close() {
    try {
      ps.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close prepared statement on connection " + owner.id(), e);
    }
  }
}
