package dbgate.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Iteration budget for a retry, poll or fill loop.
 *
 * <p>{@link #checkIteration()} returns {@code true} for the first {@code maxIterations} calls and
 * {@code false} from then on. A loop still running after ten seconds is reported once.
 *
 * <p>Not thread-safe: a guard belongs to the loop that created it.
 */
public final class LoopGuard {
  private static final Logger logger = Logger.getLogger(LoopGuard.class.getName());
  static final Duration WARN_AFTER = Duration.ofSeconds(10);

  private final String operation;
  private final long maxIterations;
  private final LongSupplier nanoClock;
  private final long startedAtNanos;
  private long iterations;
  private boolean warned;

  public LoopGuard(String operation, long maxIterations) {
    this(operation, maxIterations, System::nanoTime);
  }

  LoopGuard(String operation, long maxIterations, LongSupplier nanoClock) {
    if (maxIterations < 0) {
      throw new IllegalArgumentException("maxIterations must be >= 0, got: " + maxIterations);
    }
    this.operation = Objects.requireNonNull(operation, "operation");
    this.maxIterations = maxIterations;
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.startedAtNanos = nanoClock.getAsLong();
  }

  public boolean checkIteration() {
    iterations++;
    if (iterations > maxIterations) {
      if (iterations == maxIterations + 1) {
        logger.severe("Loop '" + operation + "' exceeded " + maxIterations + " iterations; stopping");
      }
      return false;
    }
    if (!warned && elapsed().compareTo(WARN_AFTER) > 0) {
      warned = true;
      logger.warning("Loop '" + operation + "' still running after " + elapsed().toMillis()
          + "ms (" + iterations + " iterations)");
    }
    return true;
  }

  public long iterations() {
    return iterations;
  }

  public Duration elapsed() {
    return Duration.ofNanos(nanoClock.getAsLong() - startedAtNanos);
  }

  boolean warned() {
    return warned;
  }
}
