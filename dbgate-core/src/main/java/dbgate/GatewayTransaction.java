package dbgate;

import dbgate.error.DatabaseException;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.TransactionInfo;
import dbgate.model.Value;
import dbgate.pool.PooledConnection;
import dbgate.tx.ManagedTransaction;
import dbgate.tx.TransactionState;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Transaction opened by {@link DatabaseGateway#beginTransaction}, holding its pooled connection
 * until it finishes.
 *
 * <p>Each call runs through the safety layer of the connection it holds. If a call times out, the
 * transaction is abandoned: its connection is released as broken, and the pool closes the session,
 * which rolls the transaction back, once the timed-out work returns. Later calls on an abandoned
 * transaction fail with {@code TRANSACTION_FAILED}.
 */
public final class GatewayTransaction implements AutoCloseable {
  private final PooledConnection connection;
  private final ManagedTransaction transaction;
  private final Consumer<String> preflight;

  GatewayTransaction(PooledConnection connection, ManagedTransaction transaction,
      Consumer<String> preflight) {
    this.connection = connection;
    this.transaction = transaction;
    this.preflight = preflight;
  }

  public QueryResult query(String statement, List<Value> params) {
    preflight.accept(statement);
    return call(() -> transaction.query(statement, params));
  }

  public ExecuteResult execute(String statement, List<Value> params) {
    preflight.accept(statement);
    return call(() -> transaction.execute(statement, params));
  }

  public void savepoint(String name) {
    run(() -> transaction.savepoint(name));
  }

  public void rollbackToSavepoint(String name) {
    run(() -> transaction.rollbackToSavepoint(name));
  }

  public void releaseSavepoint(String name) {
    run(() -> transaction.releaseSavepoint(name));
  }

  public void commit() {
    try {
      run(transaction::commit);
    } finally {
      releaseIfFinished();
    }
  }

  public void rollback() {
    try {
      run(transaction::rollback);
    } finally {
      releaseIfFinished();
    }
  }

  public TransactionInfo info() {
    return transaction.info();
  }

  public TransactionState state() {
    return transaction.state();
  }

  public boolean isAbandoned() {
    return transaction.isAbandoned();
  }

  /**
   * Rolls back if still active and returns the connection.
   */
  @Override
  public void close() {
    try {
      if (transaction.isActive()) {
        transaction.close();
      }
    } finally {
      connection.close();
    }
  }

  private <T> T call(Supplier<T> body) {
    try {
      return body.get();
    } catch (DatabaseException e) {
      if (transaction.isAbandoned()) {
        connection.close();
      }
      throw e;
    }
  }

  private void run(Runnable body) {
    call(() -> {
      body.run();
      return null;
    });
  }

  private void releaseIfFinished() {
    if (!transaction.isActive()) {
      connection.close();
    }
  }
}
