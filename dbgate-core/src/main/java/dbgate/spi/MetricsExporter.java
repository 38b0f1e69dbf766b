package dbgate.spi;

import dbgate.error.ErrorKind;
import dbgate.resilience.CircuitState;

/**
 * Observability hook for pool and safety-layer counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards all metrics. Every method receives the engine
 * identifier so one exporter can serve a whole {@link dbgate.pool.PoolManager}.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * A backend connection was physically opened.
     */
    void incrementConnectionsOpened(String engine);

    /**
     * A backend connection was physically closed.
     */
    void incrementConnectionsClosed(String engine);

    /**
     * A caller obtained a connection from the pool.
     */
    void incrementAcquired(String engine);

    /**
     * A caller gave up waiting for a connection.
     */
    void incrementAcquireTimeouts(String engine);

    /**
     * An operation passed through the safety layer and completed normally.
     */
    void incrementOperationSuccess(String engine);

    /**
     * An operation failed in a way that counts against the circuit breaker.
     */
    void incrementOperationFailure(String engine);

    /**
     * An operation was rejected before it ran.
     *
     * @param kind {@code CIRCUIT_OPEN}, {@code RESOURCE_LIMIT_EXCEEDED} or {@code EMERGENCY_SHUTDOWN}
     */
    default void incrementRejected(String engine, ErrorKind kind) {
    }

    /**
     * Records the current live connection count of a pool.
     */
    default void recordLiveConnections(String engine, int live) {
    }

    /**
     * Records a circuit breaker transition.
     */
    default void recordCircuitState(String engine, CircuitState state) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementConnectionsOpened(String engine) {
        }

        @Override
        public void incrementConnectionsClosed(String engine) {
        }

        @Override
        public void incrementAcquired(String engine) {
        }

        @Override
        public void incrementAcquireTimeouts(String engine) {
        }

        @Override
        public void incrementOperationSuccess(String engine) {
        }

        @Override
        public void incrementOperationFailure(String engine) {
        }
    }
}
