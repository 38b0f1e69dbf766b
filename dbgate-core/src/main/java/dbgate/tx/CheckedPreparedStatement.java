package dbgate.tx;

import dbgate.error.DatabaseException;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.Value;
import dbgate.spi.DatabasePreparedStatement;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Prepared statement that rejects a wrong parameter count before contacting the backend.
 * Executions run through the owning connection's {@link SessionGuard}.
 */
public final class CheckedPreparedStatement implements AutoCloseable {
  private final DatabasePreparedStatement delegate;
  private final Runnable precondition;
  private final SessionGuard guard;
  private final Consumer<? super CheckedPreparedStatement> onClose;
  private volatile boolean closed;

  /**
   * @param precondition runs before every execution; throws when the owning connection
   *                     can no longer be used
   * @param onClose      runs once when the statement is closed
   */
  public CheckedPreparedStatement(DatabasePreparedStatement delegate, Runnable precondition,
      SessionGuard guard, Consumer<? super CheckedPreparedStatement> onClose) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.precondition = Objects.requireNonNull(precondition, "precondition");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  public String statement() {
    return delegate.statement();
  }

  public int parameterCount() {
    return delegate.parameterCount();
  }

  public QueryResult query(List<Value> params) {
    check(params);
    return guard.query("prepared query", () -> delegate.query(params));
  }

  public ExecuteResult execute(List<Value> params) {
    check(params);
    return guard.query("prepared execute", () -> delegate.execute(params));
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      delegate.close();
    } finally {
      onClose.accept(this);
    }
  }

  /** Marks the statement closed without touching its backend session. */
  public void abandon() {
    closed = true;
  }

  private void check(List<Value> params) {
    if (closed) {
      throw DatabaseException.validation("prepared statement is closed");
    }
    precondition.run();
    int expected = delegate.parameterCount();
    int actual = params == null ? 0 : params.size();
    if (actual != expected) {
      throw DatabaseException.validation("expected " + expected + " parameters, got " + actual);
    }
  }
}
