package dbgate.jdbc;

import dbgate.error.DatabaseException;
import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.Value;
import dbgate.spi.DatabaseTransaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A transaction on a JDBC connection with auto-commit switched off.
 *
 * <p>Ending the transaction puts the connection back into auto-commit mode with the read-only
 * flag and isolation level it had before. A failed commit leaves the connection as it is, the
 * caller follows up with {@link #rollback()}. If the session state cannot be restored, the
 * connection is marked broken; after a successful COMMIT that is logged, not reported as a
 * commit failure, since the data is already durable.
 */
final class JdbcTransaction implements DatabaseTransaction {
  private static final Logger logger = Logger.getLogger(JdbcTransaction.class.getName());

  private final JdbcConnection owner;
  private final Connection connection;
  private final JdbcDialect dialect;
  private final int previousIsolation;
  private final boolean previousReadOnly;
  private final Map<String, Savepoint> savepoints = new LinkedHashMap<>();
  private boolean finished;

  JdbcTransaction(JdbcConnection owner, Connection connection, JdbcDialect dialect,
      int previousIsolation, boolean previousReadOnly) {
    this.owner = owner;
    this.connection = connection;
    this.dialect = dialect;
    this.previousIsolation = previousIsolation;
    this.previousReadOnly = previousReadOnly;
  }

  @Override
  public QueryResult query(String statement, List<Value> params) {
    ensureActive();
    owner.touch();
    return JdbcStatements.query(dialect, connection, statement, params);
  }

  @Override
  public ExecuteResult execute(String statement, List<Value> params) {
    ensureActive();
    owner.touch();
    return JdbcStatements.execute(dialect, connection, statement, params);
  }

  @Override
  public void savepoint(String name) {
    ensureActive();
    try {
      Savepoint savepoint = connection.setSavepoint(name);
      // a reused name moves to the top
      savepoints.remove(name);
      savepoints.put(name, savepoint);
    } catch (SQLException e) {
      throw JdbcErrors.translate("savepoint '" + name + "' failed", e);
    }
  }

  @Override
  public void rollbackToSavepoint(String name) {
    ensureActive();
    Savepoint savepoint = lookup(name);
    try {
      connection.rollback(savepoint);
    } catch (SQLException e) {
      throw JdbcErrors.translate("rollback to savepoint '" + name + "' failed", e);
    }
    // savepoints set after this one no longer exist on the server
    List<String> names = new ArrayList<>(savepoints.keySet());
    for (String later : names.subList(names.indexOf(name) + 1, names.size())) {
      savepoints.remove(later);
    }
  }

  @Override
  public void releaseSavepoint(String name) {
    ensureActive();
    Savepoint savepoint = lookup(name);
    List<String> names = new ArrayList<>(savepoints.keySet());
    // RELEASE also drops every later savepoint, so only the newest is released on the server
    if (names.get(names.size() - 1).equals(name)) {
      try {
        connection.releaseSavepoint(savepoint);
      } catch (SQLException e) {
        throw JdbcErrors.translate("release of savepoint '" + name + "' failed", e);
      }
    }
    savepoints.remove(name);
  }

  @Override
  public void commit() {
    ensureActive();
    try {
      connection.commit();
    } catch (SQLException e) {
      throw JdbcErrors.translate("commit failed", e);
    }
    DatabaseException failure = restore(null);
    if (failure != null) {
      logger.log(Level.WARNING, "Transaction on connection " + owner.id()
          + " committed, but the session could not be reset; it will be discarded", failure);
    }
  }

  @Override
  public void rollback() {
    if (finished) {
      return;
    }
    DatabaseException failure = null;
    try {
      connection.rollback();
    } catch (SQLException e) {
      failure = JdbcErrors.translate("rollback failed", e);
    }
    failure = restore(failure);
    if (failure != null) {
      throw failure;
    }
  }

  boolean isFinished() {
    return finished;
  }

  private DatabaseException restore(DatabaseException failure) {
    finished = true;
    savepoints.clear();
    owner.transactionEnded(this);
    try {
      connection.setAutoCommit(true);
      if (connection.isReadOnly() != previousReadOnly) {
        connection.setReadOnly(previousReadOnly);
      }
      if (connection.getTransactionIsolation() != previousIsolation) {
        connection.setTransactionIsolation(previousIsolation);
      }
      return failure;
    } catch (SQLException e) {
      owner.markBroken();
      logger.log(Level.FINE, "Failed to restore session state of connection " + owner.id(), e);
      if (failure != null) {
        failure.addSuppressed(e);
        return failure;
      }
      return JdbcErrors.translate("failed to restore session state", e);
    }
  }

  private Savepoint lookup(String name) {
    Savepoint savepoint = savepoints.get(name);
    if (savepoint == null) {
      throw DatabaseException.validation("unknown savepoint: " + name);
    }
    return savepoint;
  }

  private void ensureActive() {
    if (finished) {
      throw DatabaseException.validation("transaction already finished");
    }
  }
}
