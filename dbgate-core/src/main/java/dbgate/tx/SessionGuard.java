package dbgate.tx;

import dbgate.error.DatabaseException;
import dbgate.resilience.SafetyManager;
import dbgate.util.BackendCall;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs the calls made on one backend session through a {@link SafetyManager}: admission,
 * resource slot, deadline and circuit-breaker accounting.
 *
 * <p>A call that fails with a backend failure or times out marks the session broken. A timed-out
 * call keeps running on its worker until the backend gives up; {@link #whenIdle(Runnable)} defers
 * work that must not overlap with it, such as handing the session back to its pool, until no
 * call is left running.
 *
 * <p>{@link #direct(Runnable)} builds a guard without deadlines or breaker for sessions used
 * outside a pool.
 */
public final class SessionGuard {
  private static final Logger logger = Logger.getLogger(SessionGuard.class.getName());

  private static final int PENDING = 0;
  private static final int STARTED = 1;
  private static final int REVOKED = 2;

  private final SafetyManager safety;
  private final String target;
  private final Runnable onBroken;
  private final Object lock = new Object();
  private int running;
  private Runnable idleAction;

  /**
   * @param target   names the session in operation names and logs
   * @param onBroken runs whenever a call leaves the session unusable
   */
  public SessionGuard(SafetyManager safety, String target, Runnable onBroken) {
    this.safety = Objects.requireNonNull(safety, "safety");
    this.target = Objects.requireNonNull(target, "target");
    this.onBroken = Objects.requireNonNull(onBroken, "onBroken");
  }

  private SessionGuard(Runnable onBroken) {
    this.safety = null;
    this.target = "direct";
    this.onBroken = Objects.requireNonNull(onBroken, "onBroken");
  }

  public static SessionGuard direct(Runnable onBroken) {
    return new SessionGuard(onBroken);
  }

  /** Runs a statement under the query timeout. */
  public <T> T query(String operation, Supplier<T> body) {
    return guarded(operation, safety == null ? null : safety.timeouts().queryTimeout(), body);
  }

  /** Runs a control call (begin, savepoint, commit, schema) under the default timeout. */
  public <T> T call(String operation, Supplier<T> body) {
    return guarded(operation, safety == null ? null : safety.timeouts().defaultTimeout(), body);
  }

  public void run(String operation, Runnable body) {
    call(operation, () -> {
      body.run();
      return null;
    });
  }

  /**
   * Runs {@code action} now if no call is running on the session, otherwise as soon as the last
   * running one returns. Only the most recently registered action is kept.
   */
  public void whenIdle(Runnable action) {
    synchronized (lock) {
      if (running > 0) {
        idleAction = action;
        logger.fine(() -> "Deferring until the timed-out call on " + target + " returns");
        return;
      }
    }
    action.run();
  }

  /** Whether a call, possibly one whose caller already timed out, is still running. */
  public boolean isBusy() {
    synchronized (lock) {
      return running > 0;
    }
  }

  private <T> T guarded(String operation, Duration timeout, Supplier<T> body) {
    if (safety == null) {
      return BackendCall.call(body, onBroken);
    }
    AtomicInteger phase = new AtomicInteger(PENDING);
    synchronized (lock) {
      running++;
    }
    try {
      return safety.safeExecute(operation + " on " + target, timeout, () -> {
        if (!phase.compareAndSet(PENDING, STARTED)) {
          return null;
        }
        try {
          return BackendCall.call(body, onBroken);
        } finally {
          callEnded();
        }
      }, null);
    } catch (DatabaseException e) {
      if (e.isBackendFailure()) {
        onBroken.run();
      }
      throw e;
    } finally {
      // the body never started and now never will
      if (phase.compareAndSet(PENDING, REVOKED)) {
        callEnded();
      }
    }
  }

  private void callEnded() {
    Runnable action = null;
    synchronized (lock) {
      running--;
      if (running == 0 && idleAction != null) {
        action = idleAction;
        idleAction = null;
      }
    }
    if (action != null) {
      action.run();
    }
  }
}
