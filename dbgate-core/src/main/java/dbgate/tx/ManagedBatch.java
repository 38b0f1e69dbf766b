package dbgate.tx;

import dbgate.error.DatabaseException;
import dbgate.model.ExecuteResult;
import dbgate.model.Value;
import dbgate.spi.CommandBatch;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use handle over an adapter's {@link CommandBatch}.
 *
 * <p>Commands are queued locally by the adapter and applied together by {@link #exec()}, or
 * dropped by {@link #discard()}. Either call finishes the handle. There is no isolation level
 * and no partial rollback. Backend calls run through the owning connection's {@link SessionGuard}.
 */
public final class ManagedBatch implements AutoCloseable {
  private final CommandBatch delegate;
  private final Runnable onFinish;
  private final SessionGuard guard;
  private final AtomicBoolean finished = new AtomicBoolean();
  private int queued;

  public ManagedBatch(CommandBatch delegate, SessionGuard guard, Runnable onFinish) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.onFinish = Objects.requireNonNull(onFinish, "onFinish");
  }

  public ManagedBatch queue(String command, List<Value> params) {
    if (finished.get()) {
      throw DatabaseException.validation("batch is not open");
    }
    guard.run("batch queue", () -> delegate.queue(command, params));
    queued++;
    return this;
  }

  public List<ExecuteResult> exec() {
    claim();
    try {
      return guard.query("batch exec", delegate::exec);
    } finally {
      onFinish.run();
    }
  }

  public void discard() {
    claim();
    try {
      guard.run("batch discard", delegate::discard);
    } finally {
      onFinish.run();
    }
  }

  public int queuedCount() {
    return queued;
  }

  public boolean isOpen() {
    return !finished.get();
  }

  /** Finishes the handle without touching its backend session. */
  public void abandon() {
    if (finished.compareAndSet(false, true)) {
      onFinish.run();
    }
  }

  /** Discards if neither executed nor discarded. */
  @Override
  public void close() {
    if (!finished.get()) {
      discard();
    }
  }

  private void claim() {
    if (!finished.compareAndSet(false, true)) {
      throw DatabaseException.validation("batch is not open");
    }
  }
}
