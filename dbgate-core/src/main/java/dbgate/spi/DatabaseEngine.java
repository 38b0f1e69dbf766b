package dbgate.spi;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;
import dbgate.model.HealthStatus;

import java.util.Set;

/**
 * Backend-specific entry point: opens connections, checks health and declares capabilities.
 *
 * <p>Implementations must report their {@link DatabaseFeature} set truthfully. The core gates
 * every optional operation on that set and never inspects {@link #type()} to decide behavior.
 *
 * @see DatabaseConnection
 */
public interface DatabaseEngine extends AutoCloseable {

    /**
     * Engine type name used for registry lookup (e.g. {@code "jdbc"}).
     */
    String type();

    /**
     * Backend version string, or {@code "unknown"} when not reported.
     */
    default String version() {
        return "unknown";
    }

    /**
     * Opens a new live connection.
     *
     * @throws dbgate.error.DatabaseException with {@code CONNECTION_FAILED} when the backend
     *         cannot be reached or rejects the credentials
     */
    DatabaseConnection connect(ConnectionConfig config);

    /**
     * Checks the backend and reports its state with latency and error detail.
     * Must not throw for backend failures; those are reported as a non-healthy status.
     */
    HealthStatus healthCheck();

    /**
     * Capabilities of this engine. Pure, performs no I/O.
     */
    Set<DatabaseFeature> supportedFeatures();

    /**
     * Rejects configurations this engine cannot use.
     *
     * @throws dbgate.error.DatabaseException with {@code CONFIGURATION_ERROR}
     */
    default void validateConfig(ConnectionConfig config) {
    }

    /**
     * Releases engine-wide resources. Connections are closed by their pool, not here.
     */
    @Override
    default void close() {
    }
}
