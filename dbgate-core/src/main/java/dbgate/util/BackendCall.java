package dbgate.util;

import dbgate.error.DatabaseException;

import java.util.function.Supplier;

/**
 * Runs one call into a backend adapter and reports whether the session survived it.
 *
 * <p>The session is reported broken when the call fails with a backend-failure kind, throws
 * something other than {@link DatabaseException}, or returns on a thread that was interrupted
 * (its caller timed out, so the backend may still hold half-finished work).
 */
public final class BackendCall {

  private BackendCall() {
  }

  public static <T> T call(Supplier<T> operation, Runnable onBroken) {
    try {
      T result = operation.get();
      if (Thread.currentThread().isInterrupted()) {
        onBroken.run();
      }
      return result;
    } catch (DatabaseException e) {
      if (e.isBackendFailure() || Thread.currentThread().isInterrupted()) {
        onBroken.run();
      }
      throw e;
    } catch (RuntimeException e) {
      onBroken.run();
      throw DatabaseException.operationFailed("backend call failed: " + e, e);
    }
  }

  public static void run(Runnable operation, Runnable onBroken) {
    call(() -> {
      operation.run();
      return null;
    }, onBroken);
  }
}
