/**
 * JDBC backend for the gateway.
 *
 * <p>{@link dbgate.jdbc.JdbcEngine} maps the driver contract onto {@code java.sql}: statements
 * are always prepared, values bound and read through a fixed type table, transactions run with
 * auto-commit off and restore the session when they end, and savepoints map onto
 * {@link java.sql.Savepoint}s by name.
 */
package dbgate.jdbc;
