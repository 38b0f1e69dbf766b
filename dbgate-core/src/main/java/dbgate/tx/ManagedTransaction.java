package dbgate.tx;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.DatabaseFeature;
import dbgate.model.ExecuteResult;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.TransactionInfo;
import dbgate.model.Value;
import dbgate.spi.DatabaseTransaction;
import dbgate.util.RequestIds;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-facing transaction handle layered over an adapter's {@link DatabaseTransaction}.
 *
 * <p>State machine: {@code ACTIVE -> COMMITTED} or {@code ACTIVE -> ROLLED_BACK}, both terminal.
 * {@link #commit()} and {@link #rollback()} consume the handle: the first of them reaches the
 * backend, any later call fails with {@code VALIDATION_ERROR} and never issues a second
 * COMMIT or ROLLBACK. Statements on a finished handle fail the same way.
 *
 * <p>Savepoint operations check the engine's {@link DatabaseFeature#SAVEPOINTS} capability
 * before anything else and fail with {@code UNSUPPORTED_OPERATION} without calling the adapter.
 * Savepoint names are unique within the transaction.
 *
 * <p>Every backend call runs through the connection's {@link SessionGuard}. A call that times
 * out abandons the transaction: its session is marked broken, the pool closes it once the
 * timed-out work returns, and the backend rolls the transaction back with the session. An
 * abandoned handle stays in {@code ACTIVE} state but is no longer {@linkplain #isActive() active};
 * every later call fails with {@code TRANSACTION_FAILED}.
 *
 * <p>Use via try-with-resources: {@link #close()} rolls back a still-active transaction.
 * <pre>{@code
 * try (ManagedTransaction tx = connection.beginTransaction()) {
 *     tx.execute("INSERT INTO t VALUES (?)", List.of(Value.of(1)));
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>Not thread-safe: a transaction belongs to the caller holding its connection.
 */
public final class ManagedTransaction implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ManagedTransaction.class.getName());

  private final String id;
  private final DatabaseTransaction delegate;
  private final Set<DatabaseFeature> features;
  private final IsolationLevel isolationLevel;
  private final boolean readOnly;
  private final Instant startedAt;
  private final SessionGuard guard;
  private final Runnable onFinish;
  private final SavepointStack savepoints = new SavepointStack();
  private final AtomicBoolean finishing = new AtomicBoolean();
  private volatile TransactionState state = TransactionState.ACTIVE;
  private volatile boolean abandoned;

  /**
   * @param guard    runs every backend call of this transaction
   * @param onFinish runs once the transaction is finished or abandoned
   */
  public ManagedTransaction(DatabaseTransaction delegate, Set<DatabaseFeature> features,
      IsolationLevel isolationLevel, boolean readOnly, SessionGuard guard, Runnable onFinish) {
    this.id = RequestIds.nextTransactionId();
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.features = Set.copyOf(features);
    this.isolationLevel = Objects.requireNonNull(isolationLevel, "isolationLevel");
    this.readOnly = readOnly;
    this.startedAt = Instant.now();
    this.guard = Objects.requireNonNull(guard, "guard");
    this.onFinish = Objects.requireNonNull(onFinish, "onFinish");
  }

  public QueryResult query(String statement, List<Value> params) {
    ensureActive();
    return statement("tx query", () -> delegate.query(statement, params));
  }

  public ExecuteResult execute(String statement, List<Value> params) {
    ensureActive();
    return statement("tx execute", () -> delegate.execute(statement, params));
  }

  public void savepoint(String name) {
    requireSavepoints();
    ensureActive();
    SavepointStack.validateName(name);
    if (savepoints.contains(name)) {
      throw DatabaseException.validation("savepoint already exists: " + name);
    }
    control("savepoint " + name, () -> delegate.savepoint(name));
    savepoints.push(name);
  }

  /**
   * Rolls back to {@code name}, discarding it and every savepoint opened after it.
   */
  public void rollbackToSavepoint(String name) {
    requireSavepoints();
    ensureActive();
    if (!savepoints.contains(name)) {
      throw DatabaseException.validation("savepoint not found: " + name);
    }
    control("rollback to savepoint " + name, () -> delegate.rollbackToSavepoint(name));
    savepoints.truncateFrom(name);
  }

  /**
   * Releases exactly {@code name}; savepoints opened after it stay on the stack.
   */
  public void releaseSavepoint(String name) {
    requireSavepoints();
    ensureActive();
    if (!savepoints.contains(name)) {
      throw DatabaseException.validation("savepoint not found: " + name);
    }
    control("release savepoint " + name, () -> delegate.releaseSavepoint(name));
    savepoints.remove(name);
  }

  /**
   * Commits. If the backend rejects the commit, the transaction is rolled back and a
   * {@code TRANSACTION_FAILED} error is thrown; either way the handle is finished. A commit that
   * times out abandons the transaction without a rollback attempt, since the outcome on the
   * backend is unknown.
   */
  public void commit() {
    claimFinish();
    try {
      control("commit", delegate::commit);
      state = TransactionState.COMMITTED;
    } catch (DatabaseException e) {
      if (abandoned) {
        throw e;
      }
      DatabaseException failure = e.kind() == ErrorKind.TRANSACTION_FAILED
          ? e : DatabaseException.transactionFailed("commit failed: " + e.reason(), e);
      try {
        control("rollback after failed commit", delegate::rollback);
      } catch (RuntimeException rollbackFailure) {
        failure.addSuppressed(rollbackFailure);
      }
      state = TransactionState.ROLLED_BACK;
      throw failure;
    } finally {
      finish();
    }
  }

  public void rollback() {
    claimFinish();
    try {
      control("rollback", delegate::rollback);
    } finally {
      if (!abandoned) {
        state = TransactionState.ROLLED_BACK;
      }
      finish();
    }
  }

  /**
   * Gives the transaction up without contacting the backend. Its session must be discarded,
   * which rolls the transaction back on the backend.
   */
  public void abandon() {
    if (abandoned) {
      return;
    }
    abandoned = true;
    logger.warning("Transaction " + id + " abandoned; its session will be discarded");
    if (finishing.compareAndSet(false, true)) {
      finish();
    }
  }

  public boolean isAbandoned() {
    return abandoned;
  }

  /**
   * Rolls back if still active; otherwise does nothing.
   */
  @Override
  public void close() {
    if (!finishing.get()) {
      rollback();
    }
  }

  public String id() {
    return id;
  }

  public TransactionState state() {
    return state;
  }

  public boolean isActive() {
    return state == TransactionState.ACTIVE && !finishing.get() && !abandoned;
  }

  public TransactionInfo info() {
    return new TransactionInfo(id, isolationLevel, startedAt, savepoints.snapshot(), readOnly);
  }

  /** Open savepoint names, oldest first. */
  public List<String> savepoints() {
    return savepoints.snapshot();
  }

  private void requireSavepoints() {
    if (!features.contains(DatabaseFeature.SAVEPOINTS)) {
      throw DatabaseException.unsupported("savepoints are not supported by this engine; "
          + "roll back the whole transaction instead");
    }
  }

  private <T> T statement(String operation, Supplier<T> body) {
    try {
      return guard.query(operation, body);
    } catch (DatabaseException e) {
      abandonOnTimeout(e);
      throw e;
    }
  }

  private void control(String operation, Runnable body) {
    try {
      guard.run(operation, body);
    } catch (DatabaseException e) {
      abandonOnTimeout(e);
      throw e;
    }
  }

  private void abandonOnTimeout(DatabaseException e) {
    if (e.kind() == ErrorKind.TIMEOUT) {
      abandon();
    }
  }

  private void ensureActive() {
    requireNotAbandoned();
    if (!isActive()) {
      throw DatabaseException.validation("transaction is not active");
    }
  }

  private void requireNotAbandoned() {
    if (abandoned) {
      throw DatabaseException.transactionFailed("transaction " + id
          + " was abandoned after a timeout", null);
    }
  }

  private void claimFinish() {
    requireNotAbandoned();
    if (!finishing.compareAndSet(false, true)) {
      throw DatabaseException.validation("transaction is not active");
    }
  }

  private void finish() {
    savepoints.clear();
    try {
      onFinish.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transaction " + id + " finish callback failed", e);
    }
  }
}
