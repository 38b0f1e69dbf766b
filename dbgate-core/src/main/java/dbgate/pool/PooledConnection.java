package dbgate.pool;

import dbgate.error.DatabaseException;
import dbgate.model.ConnectionInfo;
import dbgate.model.DatabaseFeature;
import dbgate.model.DatabaseSchema;
import dbgate.model.ExecuteResult;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.TableInfo;
import dbgate.model.Value;
import dbgate.spi.DatabaseConnection;
import dbgate.spi.DatabaseTransaction;
import dbgate.tx.CheckedPreparedStatement;
import dbgate.tx.ManagedBatch;
import dbgate.tx.ManagedTransaction;
import dbgate.tx.SessionGuard;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A connection on loan from a {@link ConnectionPool}, owned by one caller until {@link #close()}.
 *
 * <p>Optional operations check the engine's capability set first and fail with
 * {@code UNSUPPORTED_OPERATION} without touching the backend. While a transaction or batch is
 * open, statements must go through that handle; calls on the connection itself fail with
 * {@code VALIDATION_ERROR}.
 *
 * <p>Every backend call, including those made through the transaction, batch and prepared
 * statement handles opened here, runs through the engine's {@link dbgate.resilience.SafetyManager}
 * under the query or default timeout. A backend failure or a timed-out call marks the connection
 * broken, and it is physically closed on release instead of returning to the idle set.
 *
 * <p>Closing rolls back an open transaction, discards an open batch and closes open prepared
 * statements first. A broken connection skips that cleanup, since closing the session undoes it
 * on the backend. If a timed-out call is still running, the connection goes back to the pool only
 * once that call returns.
 */
public final class PooledConnection implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PooledConnection.class.getName());

  private final ConnectionPool pool;
  private final PoolEntry entry;
  private final Set<DatabaseFeature> features;
  private final SessionGuard guard;
  private final List<CheckedPreparedStatement> statements = new CopyOnWriteArrayList<>();
  private final AtomicBoolean released = new AtomicBoolean();
  private volatile boolean broken;
  private volatile ManagedTransaction transaction;
  private volatile ManagedBatch batch;

  PooledConnection(ConnectionPool pool, PoolEntry entry, Set<DatabaseFeature> features) {
    this.pool = pool;
    this.entry = entry;
    this.features = features;
    this.guard = new SessionGuard(pool.safety(), entry.id + " of " + pool.engineId(), this::invalidate);
  }

  public QueryResult query(String statement, List<Value> params) {
    ensureIdleSession();
    return guard.query("query", () -> backend().query(statement, params));
  }

  public QueryResult query(String statement, Value... params) {
    return query(statement, List.of(params));
  }

  public ExecuteResult execute(String statement, List<Value> params) {
    ensureIdleSession();
    return guard.query("execute", () -> backend().execute(statement, params));
  }

  public ExecuteResult execute(String statement, Value... params) {
    return execute(statement, List.of(params));
  }

  public ManagedTransaction beginTransaction() {
    return beginTransaction(IsolationLevel.READ_COMMITTED, false);
  }

  /**
   * @throws DatabaseException {@code UNSUPPORTED_OPERATION} if the engine lacks
   *         {@link DatabaseFeature#TRANSACTIONS}
   */
  public ManagedTransaction beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
    ensureUsable();
    require(DatabaseFeature.TRANSACTIONS, "transactions");
    ensureIdleSession();
    DatabaseTransaction raw = guard.call("begin transaction",
        () -> backend().beginTransaction(isolationLevel, readOnly));
    ManagedTransaction tx = new ManagedTransaction(raw, features, isolationLevel, readOnly,
        guard, () -> transaction = null);
    transaction = tx;
    return tx;
  }

  /**
   * @throws DatabaseException {@code UNSUPPORTED_OPERATION} if the engine lacks
   *         {@link DatabaseFeature#PREPARED_STATEMENTS}
   */
  public CheckedPreparedStatement prepare(String statement) {
    ensureUsable();
    require(DatabaseFeature.PREPARED_STATEMENTS, "prepared statements");
    ensureIdleSession();
    CheckedPreparedStatement prepared = new CheckedPreparedStatement(
        guard.call("prepare", () -> backend().prepare(statement)),
        this::ensureIdleSession, guard, statements::remove);
    statements.add(prepared);
    return prepared;
  }

  /**
   * @throws DatabaseException {@code UNSUPPORTED_OPERATION} if the engine lacks
   *         {@link DatabaseFeature#ATOMIC_BATCH}
   */
  public ManagedBatch beginBatch() {
    ensureUsable();
    require(DatabaseFeature.ATOMIC_BATCH, "atomic batches");
    ensureIdleSession();
    ManagedBatch opened = new ManagedBatch(
        guard.call("begin batch", () -> backend().beginBatch()), guard, () -> batch = null);
    batch = opened;
    return opened;
  }

  public DatabaseSchema schema() {
    ensureUsable();
    require(DatabaseFeature.SCHEMA_INTROSPECTION, "schema introspection");
    ensureIdleSession();
    return guard.call("schema", () -> backend().schema());
  }

  public TableInfo tableSchema(String table) {
    ensureUsable();
    require(DatabaseFeature.SCHEMA_INTROSPECTION, "schema introspection");
    ensureIdleSession();
    return guard.call("table schema", () -> backend().tableSchema(table));
  }

  public boolean ping() {
    ensureUsable();
    boolean alive = guard.call("ping", () -> backend().ping());
    if (!alive) {
      invalidate();
    }
    return alive;
  }

  public ConnectionInfo info() {
    ensureUsable();
    return backend().info();
  }

  public String id() {
    return entry.id;
  }

  public String engineId() {
    return pool.engineId();
  }

  public Set<DatabaseFeature> features() {
    return features;
  }

  public boolean supports(DatabaseFeature feature) {
    return features.contains(feature);
  }

  /** Whether this handle may still be used: not released and not broken. */
  public boolean isValid() {
    return !released.get() && !broken;
  }

  public boolean isBroken() {
    return broken;
  }

  /**
   * Marks the backend session unusable; it will be closed on release.
   */
  public void invalidate() {
    broken = true;
  }

  /** Prepared statements opened on this connection and not yet closed. */
  public int openStatementCount() {
    return statements.size();
  }

  /**
   * Returns the connection to its pool. Idempotent.
   */
  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      if (broken || guard.isBusy()) {
        broken = true;
        abandonOpenUnits();
      } else {
        finishOpenUnits();
      }
    } finally {
      guard.whenIdle(() -> pool.release(entry, broken));
    }
  }

  private void abandonOpenUnits() {
    ManagedTransaction tx = transaction;
    if (tx != null) {
      tx.abandon();
    }
    ManagedBatch open = batch;
    if (open != null) {
      open.abandon();
    }
    for (CheckedPreparedStatement statement : new ArrayList<>(statements)) {
      statement.abandon();
    }
    statements.clear();
  }

  private void finishOpenUnits() {
    ManagedTransaction tx = transaction;
    if (tx != null && tx.isActive()) {
      try {
        tx.rollback();
      } catch (RuntimeException e) {
        broken = true;
        logger.log(Level.WARNING, "Rollback of " + tx.id() + " on release of " + entry.id + " failed", e);
      }
    }
    ManagedBatch open = batch;
    if (open != null && open.isOpen()) {
      try {
        open.discard();
      } catch (RuntimeException e) {
        broken = true;
        logger.log(Level.WARNING, "Discard of open batch on release of " + entry.id + " failed", e);
      }
    }
    for (CheckedPreparedStatement statement : new ArrayList<>(statements)) {
      try {
        statement.close();
      } catch (RuntimeException e) {
        broken = true;
        logger.log(Level.WARNING, "Close of prepared statement on release of " + entry.id + " failed", e);
      }
    }
    statements.clear();
  }

  private DatabaseConnection backend() {
    return entry.connection;
  }

  private void ensureUsable() {
    if (released.get()) {
      throw DatabaseException.validation("connection has been returned to the pool");
    }
    if (broken) {
      throw DatabaseException.validation("connection is broken and must be released");
    }
  }

  private void ensureIdleSession() {
    ensureUsable();
    ManagedTransaction tx = transaction;
    if (tx != null && tx.isActive()) {
      throw DatabaseException.validation("connection has an active transaction " + tx.id());
    }
    ManagedBatch open = batch;
    if (open != null && open.isOpen()) {
      throw DatabaseException.validation("connection has an open batch");
    }
  }

  private void require(DatabaseFeature feature, String description) {
    if (!features.contains(feature)) {
      throw DatabaseException.unsupported(description + " are not supported by engine '"
          + pool.engineId() + "'");
    }
  }
}
