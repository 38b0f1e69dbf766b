package dbgate.micrometer;

import dbgate.error.ErrorKind;
import dbgate.resilience.CircuitState;
import dbgate.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered the first time an engine reports, each tagged with
 * {@code engine=<id>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbgate.connections.opened} / {@code dbgate.connections.closed}: physical
 *   backend connections</li>
 *   <li>{@code dbgate.pool.acquired}: connections handed to callers</li>
 *   <li>{@code dbgate.pool.acquire.timeouts}: callers that gave up waiting</li>
 *   <li>{@code dbgate.operations.success} / {@code dbgate.operations.failure}: operations
 *   through the safety layer, failures as counted by the circuit breaker</li>
 *   <li>{@code dbgate.operations.rejected}: operations refused before running, tagged with
 *   {@code reason}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dbgate.pool.connections.live}: live connections per pool</li>
 *   <li>{@code dbgate.circuit.state}: 0 closed, 1 half-open, 2 open</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, EngineMeters> engines = new ConcurrentHashMap<>();
  private final Map<String, Counter> rejected = new ConcurrentHashMap<>();
  private final List<Meter> registered = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dbgate"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dbgate");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.dbgate"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementConnectionsOpened(String engine) {
    if (closed) return;
    meters(engine).connectionsOpened.increment();
  }

  @Override
  public void incrementConnectionsClosed(String engine) {
    if (closed) return;
    meters(engine).connectionsClosed.increment();
  }

  @Override
  public void incrementAcquired(String engine) {
    if (closed) return;
    meters(engine).acquired.increment();
  }

  @Override
  public void incrementAcquireTimeouts(String engine) {
    if (closed) return;
    meters(engine).acquireTimeouts.increment();
  }

  @Override
  public void incrementOperationSuccess(String engine) {
    if (closed) return;
    meters(engine).operationSuccess.increment();
  }

  @Override
  public void incrementOperationFailure(String engine) {
    if (closed) return;
    meters(engine).operationFailure.increment();
  }

  @Override
  public void incrementRejected(String engine, ErrorKind kind) {
    if (closed) return;
    String reason = kind.name().toLowerCase(Locale.ROOT);
    rejected.computeIfAbsent(engine + '\u0000' + reason, key -> track(
        Counter.builder(namePrefix + ".operations.rejected")
            .description("Operations rejected before running")
            .tag("engine", engine)
            .tag("reason", reason)
            .register(registry)))
        .increment();
  }

  @Override
  public void recordLiveConnections(String engine, int live) {
    if (closed) return;
    meters(engine).liveConnections.set(live);
  }

  @Override
  public void recordCircuitState(String engine, CircuitState state) {
    if (closed) return;
    meters(engine).circuitState.set(stateCode(state));
  }

  static int stateCode(CircuitState state) {
    switch (state) {
      case HALF_OPEN:
        return 1;
      case OPEN:
        return 2;
      case CLOSED:
      default:
        return 0;
    }
  }

  private EngineMeters meters(String engine) {
    return engines.computeIfAbsent(engine, EngineMeters::new);
  }

  private <M extends Meter> M track(M meter) {
    registered.add(meter);
    return meter;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the gateway is closed) to
   * prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : new ArrayList<>(registered)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    registered.clear();
    engines.clear();
    rejected.clear();
    if (first != null) throw first;
  }

  private final class EngineMeters {
    final Counter connectionsOpened;
    final Counter connectionsClosed;
    final Counter acquired;
    final Counter acquireTimeouts;
    final Counter operationSuccess;
    final Counter operationFailure;
    final AtomicInteger liveConnections = new AtomicInteger();
    final AtomicInteger circuitState = new AtomicInteger();

    EngineMeters(String engine) {
      connectionsOpened = counter(engine, ".connections.opened", "Backend connections opened");
      connectionsClosed = counter(engine, ".connections.closed", "Backend connections closed");
      acquired = counter(engine, ".pool.acquired", "Connections handed to callers");
      acquireTimeouts = counter(engine, ".pool.acquire.timeouts", "Callers that gave up waiting for a connection");
      operationSuccess = counter(engine, ".operations.success", "Operations completed normally");
      operationFailure = counter(engine, ".operations.failure", "Operations that counted against the circuit breaker");
      track(Gauge.builder(namePrefix + ".pool.connections.live", liveConnections, AtomicInteger::get)
          .description("Live connections in the pool")
          .tag("engine", engine)
          .register(registry));
      track(Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
          .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
          .tag("engine", engine)
          .register(registry));
    }

    private Counter counter(String engine, String suffix, String description) {
      return track(Counter.builder(namePrefix + suffix)
          .description(description)
          .tag("engine", engine)
          .register(registry));
    }
  }
}
