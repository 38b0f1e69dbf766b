package dbgate.jdbc;

import dbgate.error.DatabaseException;
import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.model.ConnectionInfo;
import dbgate.model.DatabaseSchema;
import dbgate.model.ExecuteResult;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.TableInfo;
import dbgate.model.Value;
import dbgate.spi.DatabaseConnection;
import dbgate.spi.DatabasePreparedStatement;
import dbgate.spi.DatabaseTransaction;
import dbgate.util.RequestIds;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One JDBC session. Not thread-safe; the pool hands it to one caller at a time.
 *
 * <p>A session whose state could not be restored after a transaction reports itself closed and
 * fails its ping, so the pool discards it instead of lending it out again.
 */
final class JdbcConnection implements DatabaseConnection {
  private static final Logger logger = Logger.getLogger(JdbcConnection.class.getName());

  private final String id = RequestIds.nextConnectionId();
  private final Connection connection;
  private final JdbcDialect dialect;
  private final String database;
  private final String user;
  private final String serverVersion;
  private final Instant connectedAt = Instant.now();
  private volatile Instant lastActivity = connectedAt;
  private JdbcTransaction transaction;
  private volatile boolean sessionBroken;

  JdbcConnection(Connection connection, JdbcDialect dialect) throws SQLException {
    this.connection = connection;
    this.dialect = dialect;
    DatabaseMetaData meta = connection.getMetaData();
    this.database = connection.getCatalog();
    this.user = meta.getUserName();
    this.serverVersion = meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
  }

  String id() {
    return id;
  }

  Connection jdbc() {
    return connection;
  }

  void touch() {
    lastActivity = Instant.now();
  }

  void markBroken() {
    sessionBroken = true;
  }

  boolean isSessionBroken() {
    return sessionBroken;
  }

  void transactionEnded(JdbcTransaction ended) {
    if (transaction == ended) {
      transaction = null;
    }
  }

  @Override
  public QueryResult query(String statement, List<Value> params) {
    touch();
    return JdbcStatements.query(dialect, connection, statement, params);
  }

  @Override
  public ExecuteResult execute(String statement, List<Value> params) {
    touch();
    return JdbcStatements.execute(dialect, connection, statement, params);
  }

  @Override
  public DatabaseTransaction beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
    if (transaction != null && !transaction.isFinished()) {
      throw DatabaseException.validation("a transaction is already open on connection " + id);
    }
    touch();
    try {
      int previousIsolation = connection.getTransactionIsolation();
      boolean previousReadOnly = connection.isReadOnly();
      connection.setTransactionIsolation(jdbcLevel(isolationLevel));
      if (readOnly != previousReadOnly) {
        connection.setReadOnly(readOnly);
      }
      connection.setAutoCommit(false);
      transaction = new JdbcTransaction(this, connection, dialect, previousIsolation, previousReadOnly);
      return transaction;
    } catch (SQLException e) {
      throw JdbcErrors.translate("begin transaction failed", e);
    }
  }

  @Override
  public DatabasePreparedStatement prepare(String statement) {
    touch();
    PreparedStatement ps = null;
    try {
      ps = JdbcStatements.prepareCommand(connection, statement);
      return new JdbcPreparedStatement(this, dialect, statement, ps);
    } catch (SQLException e) {
      DatabaseException failure = JdbcErrors.translate("prepare failed", e);
      if (ps != null) {
        try {
          ps.close();
        } catch (SQLException closeFailure) {
          failure.addSuppressed(closeFailure);
        }
      }
      throw failure;
    }
  }

  @Override
  public DatabaseSchema schema() {
    touch();
    try {
      return new JdbcSchemaReader(connection).read();
    } catch (SQLException e) {
      throw JdbcErrors.translate("schema introspection failed", e);
    }
  }

  @Override
  public TableInfo tableSchema(String table) {
    touch();
    try {
      return new JdbcSchemaReader(connection).readTable(table)
          .orElseThrow(() -> DatabaseException.validation("table not found: " + table));
    } catch (SQLException e) {
      throw JdbcErrors.translate("schema introspection failed", e);
    }
  }

  @Override
  public boolean ping() {
    if (sessionBroken) {
      return false;
    }
    try {
      return connection.isValid(5);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Ping failed on connection " + id, e);
      return false;
    }
  }

  @Override
  public ConnectionInfo info() {
    return new ConnectionInfo(id, database, user, serverVersion, connectedAt, lastActivity);
  }

  @Override
  public boolean isClosed() {
    if (sessionBroken) {
      return true;
    }
    try {
      return connection.isClosed();
    } catch (SQLException e) {
      logger.log(Level.FINE, "isClosed failed on connection " + id, e);
      return true;
    }
  }

  @Override
  public void close() {
    try {
      if (transaction != null && !transaction.isFinished()) {
        transaction.rollback();
      }
    } catch (DatabaseException e) {
      logger.log(Level.WARNING, "Rollback on close failed for connection " + id, e);
    } finally {
      try {
        connection.close();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to close connection " + id, e);
      }
    }
  }

  static int jdbcLevel(IsolationLevel level) {
    switch (level) {
      case READ_UNCOMMITTED:
        return Connection.TRANSACTION_READ_UNCOMMITTED;
      case REPEATABLE_READ:
        return Connection.TRANSACTION_REPEATABLE_READ;
      case SERIALIZABLE:
        return Connection.TRANSACTION_SERIALIZABLE;
      case READ_COMMITTED:
      default:
        return Connection.TRANSACTION_READ_COMMITTED;
    }
  }
}
