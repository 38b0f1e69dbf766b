/**
 * Capability-aware data access over heterogeneous database backends.
 *
 * <p>{@link dbgate.DatabaseGateway} is the caller-facing entry point. Backends plug in through
 * {@link dbgate.spi.DatabaseEngine}; pooling lives in {@code dbgate.pool}, the safety layer in
 * {@code dbgate.resilience} and transaction orchestration in {@code dbgate.tx}.
 */
package dbgate;
