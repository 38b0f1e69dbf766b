package dbgate.resilience;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Caller-side retry of transient failures.
 *
 * <p>Nothing inside the core retries on its own; callers that want retries wrap their call in
 * an executor. Attempts are bounded by a {@link LoopGuard}. Only kinds in the retryable set
 * (by default {@code CONNECTION_FAILED}, {@code TIMEOUT}, {@code POOL_ERROR}) are retried;
 * everything else propagates at once.
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  public static final Set<ErrorKind> DEFAULT_RETRYABLE =
      Set.copyOf(EnumSet.of(ErrorKind.CONNECTION_FAILED, ErrorKind.TIMEOUT, ErrorKind.POOL_ERROR));

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final int maxAttempts;
  private final Set<ErrorKind> retryable;
  private final Sleeper sleeper;

  public RetryExecutor(RetryPolicy policy, int maxAttempts) {
    this(policy, maxAttempts, DEFAULT_RETRYABLE);
  }

  public RetryExecutor(RetryPolicy policy, int maxAttempts, Set<ErrorKind> retryable) {
    this(policy, maxAttempts, retryable, d -> Thread.sleep(d.toMillis()));
  }

  RetryExecutor(RetryPolicy policy, int maxAttempts, Set<ErrorKind> retryable, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.policy = Objects.requireNonNull(policy, "policy");
    this.maxAttempts = maxAttempts;
    this.retryable = Set.copyOf(retryable);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public <T> T execute(String operationName, Supplier<T> operation) {
    LoopGuard guard = new LoopGuard("retry " + operationName, maxAttempts);
    DatabaseException last = null;
    int attempt = 0;
    while (guard.checkIteration()) {
      attempt++;
      try {
        return operation.get();
      } catch (DatabaseException e) {
        if (!retryable.contains(e.kind())) {
          throw e;
        }
        last = e;
        if (attempt >= maxAttempts) {
          break;
        }
        Duration delay = policy.delayAfter(attempt);
        logger.fine("Retrying '" + operationName + "' in " + delay.toMillis() + "ms after attempt "
            + attempt + ": " + e.getMessage());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          DatabaseException interrupted =
              DatabaseException.operationFailed("retry of '" + operationName + "' interrupted", ie);
          interrupted.addSuppressed(e);
          throw interrupted;
        }
      }
    }
    logger.warning("'" + operationName + "' failed after " + attempt + " attempts");
    throw last;
  }
}
