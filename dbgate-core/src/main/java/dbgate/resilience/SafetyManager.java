package dbgate.resilience;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.spi.MetricsExporter;
import dbgate.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The funnel every database call passes through.
 *
 * <p>{@link #safeExecute} checks, in order: the emergency-shutdown flag, the circuit breaker and
 * a resource slot. It then runs the operation under a deadline and reports the outcome to the
 * breaker. Classification:
 * <ul>
 *   <li>Completed normally: success.
 *   <li>Timed out, or failed with a {@linkplain ErrorKind#isBackendFailure() backend failure}: failure.
 *   <li>Rejected before running ({@code CIRCUIT_OPEN}, {@code RESOURCE_LIMIT_EXCEEDED},
 *       {@code EMERGENCY_SHUTDOWN}) or failed with a contract violation: not recorded.
 * </ul>
 *
 * <p>Operations run on a cached pool of daemon threads. When a deadline passes, the worker is
 * interrupted and the caller gets {@code TIMEOUT}; once the worker finishes, whatever it
 * produced is handed to the optional orphan handler so resources it holds can be released.
 * Cleanup that must not be abandoned, such as handing a connection back, goes through
 * {@link #runToCompletion}.
 *
 * <p>Create instances via {@link #builder()}. {@link #forEngine(String)} derives a manager with
 * its own circuit breaker that shares this manager's monitor, timeouts and threads.
 */
public final class SafetyManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SafetyManager.class.getName());

  private final String name;
  private final TimeoutConfig timeouts;
  private final CircuitBreaker circuitBreaker;
  private final ResourceMonitor resourceMonitor;
  private final MetricsExporter metrics;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final LongSupplier nanoClock;

  private SafetyManager(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.timeouts = builder.timeouts != null ? builder.timeouts : TimeoutConfig.defaults();
    this.resourceMonitor = builder.resourceMonitor != null ? builder.resourceMonitor : new ResourceMonitor();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.nanoClock = builder.nanoClock != null ? builder.nanoClock : System::nanoTime;
    CircuitBreakerConfig breakerConfig = builder.circuitBreakerConfig != null
        ? builder.circuitBreakerConfig : CircuitBreakerConfig.DEFAULT;
    this.circuitBreaker = new CircuitBreaker(name, breakerConfig, nanoClock,
        state -> metrics.recordCircuitState(name, state));
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("dbgate-safety-"));
      this.ownsExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Derives a manager for one engine: separate circuit breaker, shared everything else.
   * Closing the derived manager leaves the shared threads running.
   */
  public SafetyManager forEngine(String engineId) {
    return builder()
        .name(engineId)
        .timeouts(timeouts)
        .circuitBreaker(circuitBreaker.config())
        .resourceMonitor(resourceMonitor)
        .metrics(metrics)
        .executor(executor)
        .nanoClock(nanoClock)
        .build();
  }

  /**
   * Runs {@code operation} under the default timeout.
   */
  public <T> T safeExecute(String operationName, Callable<T> operation) {
    return safeExecute(operationName, timeouts.defaultTimeout(), operation, null);
  }

  public <T> T safeExecute(String operationName, Duration timeout, Callable<T> operation) {
    return safeExecute(operationName, timeout, operation, null);
  }

  /**
   * Runs {@code operation} through the full funnel.
   *
   * @param orphanHandler receives the result (or {@code null} if it failed) of an operation
   *                      that finished after its caller timed out; may be {@code null}
   * @throws DatabaseException the operation's own failure, or {@code TIMEOUT},
   *         {@code CIRCUIT_OPEN}, {@code RESOURCE_LIMIT_EXCEEDED}, {@code EMERGENCY_SHUTDOWN}
   */
  public <T> T safeExecute(String operationName, Duration timeout, Callable<T> operation,
      Consumer<? super T> orphanHandler) {
    admit(operationName);
    ResourceMonitor.Slot slot;
    try {
      slot = resourceMonitor.reserve();
    } catch (DatabaseException e) {
      metrics.incrementRejected(name, e.kind());
      logger.warning("'" + operationName + "' on '" + name + "' rejected: " + e.reason());
      throw e;
    }
    try (slot) {
      T result = withTimeout(operationName, timeout, operation, orphanHandler);
      circuitBreaker.recordSuccess();
      metrics.incrementOperationSuccess(name);
      return result;
    } catch (DatabaseException e) {
      reportFailure(e);
      throw e;
    } catch (RuntimeException | Error e) {
      circuitBreaker.recordFailure();
      metrics.incrementOperationFailure(name);
      throw e;
    }
  }

  /**
   * Rejects an operation up front when emergency shutdown is active or the circuit is open.
   * Used on its own before borrowing a connection, so a rejected caller never waits on the pool.
   *
   * @throws DatabaseException {@code EMERGENCY_SHUTDOWN} or {@code CIRCUIT_OPEN}
   */
  public void admit(String operationName) {
    if (resourceMonitor.isEmergencyShutdown()) {
      metrics.incrementRejected(name, ErrorKind.EMERGENCY_SHUTDOWN);
      throw DatabaseException.emergencyShutdown("'" + operationName + "' refused: "
          + resourceMonitor.shutdownReason());
    }
    if (!circuitBreaker.canExecute()) {
      metrics.incrementRejected(name, ErrorKind.CIRCUIT_OPEN);
      throw DatabaseException.circuitOpen("circuit '" + name + "' is open; '"
          + operationName + "' rejected");
    }
  }

  /**
   * Counts a failure that happened outside {@link #safeExecute}, such as a failed connect,
   * against the circuit breaker. Anything but a backend failure is ignored.
   */
  public void reportFailure(DatabaseException failure) {
    if (failure.isBackendFailure()) {
      circuitBreaker.recordFailure();
      metrics.incrementOperationFailure(name);
    }
  }

  /**
   * Runs a pool operation under the pool timeout only.
   * No breaker, no slot: backend calls made on the borrowed connection account for themselves.
   */
  public <T> T safePoolOperation(String operationName, Callable<T> operation,
      Consumer<? super T> orphanHandler) {
    return withTimeout(operationName, timeouts.poolTimeout(), operation, orphanHandler);
  }

  /**
   * Runs {@code operation} on a worker thread and waits at most {@code timeout}.
   *
   * @throws DatabaseException {@code TIMEOUT} when the deadline passes
   */
  public <T> T withTimeout(String operationName, Duration timeout, Callable<T> operation,
      Consumer<? super T> orphanHandler) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(timeout, "timeout");
    TimedCall<T> call = new TimedCall<>(operationName, operation, orphanHandler);
    try {
      executor.execute(call);
    } catch (RejectedExecutionException e) {
      throw DatabaseException.operationFailed("safety executor is shut down", e);
    }
    boolean completed;
    try {
      completed = call.await(timeout.toNanos());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      completed = !call.abandon();
      if (!completed) {
        throw DatabaseException.operationFailed("interrupted while waiting for '" + operationName + "'", e);
      }
    }
    if (!completed) {
      logger.warning("'" + operationName + "' on '" + name + "' timed out after " + timeout.toMillis() + "ms");
      throw DatabaseException.timeout("'" + operationName + "' timed out after " + timeout.toMillis() + "ms");
    }
    Throwable failure = call.failure();
    if (failure == null) {
      return call.result();
    }
    if (failure instanceof RuntimeException re) {
      throw re;
    }
    if (failure instanceof Error err) {
      throw err;
    }
    throw DatabaseException.operationFailed("'" + operationName + "' failed", failure);
  }

  /**
   * Runs cleanup that must happen exactly once, waiting for it at most the pool timeout.
   * The cleanup is never cancelled: when the wait ends first, it finishes in the background.
   * A caller that was interrupted still waits; its interrupt status is restored afterwards.
   *
   * @return {@code true} if the cleanup finished within the pool timeout
   */
  public boolean runToCompletion(String operationName, Runnable cleanup) {
    CountDownLatch done = new CountDownLatch(1);
    Runnable task = () -> {
      try {
        cleanup.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "'" + operationName + "' on '" + name + "' failed", e);
      } finally {
        done.countDown();
      }
    };
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      task.run();
      return true;
    }
    boolean interrupted = Thread.interrupted();
    try {
      while (true) {
        try {
          if (done.await(timeouts.poolTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
            return true;
          }
          logger.warning("'" + operationName + "' on '" + name + "' still running after "
              + timeouts.poolTimeout().toMillis() + "ms; it will finish in the background");
          return false;
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  public String name() {
    return name;
  }

  public TimeoutConfig timeouts() {
    return timeouts;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  public ResourceMonitor resourceMonitor() {
    return resourceMonitor;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }

  public static final class Builder {
    private String name = "default";
    private TimeoutConfig timeouts;
    private CircuitBreakerConfig circuitBreakerConfig;
    private ResourceMonitor resourceMonitor;
    private MetricsExporter metrics;
    private ExecutorService executor;
    private LongSupplier nanoClock;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder timeouts(TimeoutConfig timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public Builder circuitBreaker(CircuitBreakerConfig circuitBreakerConfig) {
      this.circuitBreakerConfig = circuitBreakerConfig;
      return this;
    }

    public Builder resourceMonitor(ResourceMonitor resourceMonitor) {
      this.resourceMonitor = resourceMonitor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Worker threads for timed calls. The manager does not shut down an executor it was given.
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /** Clock for circuit-breaker recovery timing, for tests. */
    public Builder nanoClock(LongSupplier nanoClock) {
      this.nanoClock = nanoClock;
      return this;
    }

    public SafetyManager build() {
      return new SafetyManager(this);
    }
  }
}
