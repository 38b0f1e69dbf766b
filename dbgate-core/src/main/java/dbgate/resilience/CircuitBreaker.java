package dbgate.resilience;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Three-state guard that stops calling a consistently failing backend.
 *
 * <p>Transitions:
 * <ul>
 *   <li>{@code CLOSED -> OPEN} after {@code failureThreshold} consecutive failures.
 *   <li>{@code OPEN -> HALF_OPEN} on the first {@link #canExecute()} after
 *       {@code recoveryTimeout} has elapsed since opening.
 *   <li>{@code HALF_OPEN -> CLOSED} after {@code successThreshold} consecutive successes.
 *   <li>{@code HALF_OPEN -> OPEN} on any failure.
 * </ul>
 *
 * <p>All methods are synchronized; the transition listener runs under the lock and must be cheap.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final CircuitBreakerConfig config;
  private final LongSupplier nanoClock;
  private final Consumer<CircuitState> listener;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private int consecutiveSuccesses;
  private long openedAtNanos;

  public CircuitBreaker(String name, CircuitBreakerConfig config) {
    this(name, config, System::nanoTime, state -> { });
  }

  public CircuitBreaker(String name, CircuitBreakerConfig config,
      LongSupplier nanoClock, Consumer<CircuitState> listener) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Whether a call may proceed. May move an expired {@code OPEN} circuit to {@code HALF_OPEN}.
   */
  public synchronized boolean canExecute() {
    switch (state) {
      case CLOSED:
      case HALF_OPEN:
        return true;
      case OPEN:
        if (nanoClock.getAsLong() - openedAtNanos >= config.recoveryTimeout().toNanos()) {
          consecutiveSuccesses = 0;
          transition(CircuitState.HALF_OPEN);
          return true;
        }
        return false;
      default:
        throw new IllegalStateException("Unknown circuit state: " + state);
    }
  }

  public synchronized void recordSuccess() {
    switch (state) {
      case CLOSED:
        consecutiveFailures = 0;
        break;
      case HALF_OPEN:
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= config.successThreshold()) {
          consecutiveFailures = 0;
          consecutiveSuccesses = 0;
          transition(CircuitState.CLOSED);
        }
        break;
      case OPEN:
        // late completion of a call admitted before the circuit opened
        break;
      default:
        throw new IllegalStateException("Unknown circuit state: " + state);
    }
  }

  public synchronized void recordFailure() {
    switch (state) {
      case CLOSED:
        consecutiveFailures++;
        if (consecutiveFailures >= config.failureThreshold()) {
          open(consecutiveFailures + " consecutive failures");
        }
        break;
      case HALF_OPEN:
        consecutiveSuccesses = 0;
        open("failed trial call");
        break;
      case OPEN:
        break;
      default:
        throw new IllegalStateException("Unknown circuit state: " + state);
    }
  }

  /**
   * Forces the circuit back to {@code CLOSED} with cleared counters.
   */
  public synchronized void reset() {
    consecutiveFailures = 0;
    consecutiveSuccesses = 0;
    if (state != CircuitState.CLOSED) {
      transition(CircuitState.CLOSED);
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  public String name() {
    return name;
  }

  public CircuitBreakerConfig config() {
    return config;
  }

  private void open(String cause) {
    openedAtNanos = nanoClock.getAsLong();
    logger.warning("Circuit '" + name + "' opened after " + cause
        + "; rejecting calls for " + config.recoveryTimeout());
    transition(CircuitState.OPEN);
  }

  private void transition(CircuitState next) {
    CircuitState previous = state;
    state = next;
    logger.info("Circuit '" + name + "' " + previous + " -> " + next);
    listener.accept(next);
  }
}
