/**
 * Service Provider Interfaces implemented by backend adapters and integrators.
 *
 * <p>Adapters implement the engine, connection, transaction and prepared-statement contract.
 * Integrators plug in pre-flight validation and metrics.
 *
 * @see dbgate.spi.DatabaseEngine
 * @see dbgate.spi.DatabaseConnection
 * @see dbgate.spi.QueryValidator
 * @see dbgate.spi.MetricsExporter
 */
package dbgate.spi;
