package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * SPI for database-specific behavior of the JDBC engine.
 *
 * <p>A dialect declares what its database can do, how to reach it from a host/port/database
 * configuration, and how JSON crosses the driver boundary.
 * Register custom dialects via {@code META-INF/services/dbgate.jdbc.dialect.JdbcDialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL, MySQL (+ MariaDB).
 *
 * @see JdbcDialects
 */
public interface JdbcDialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Product names the driver reports through {@link java.sql.DatabaseMetaData#getDatabaseProductName()},
   * used to detect the dialect from a live connection.
   */
  default List<String> productNames() {
    return List.of();
  }

  /**
   * Capabilities of the database behind this dialect.
   */
  Set<DatabaseFeature> features();

  /**
   * JDBC URL for a configuration without an explicit URL.
   */
  String url(ConnectionConfig config);

  /**
   * Cheap statement used by health checks.
   */
  default String healthCheckSql() {
    return "SELECT 1";
  }

  /**
   * Single-row, single-column query returning the server version.
   */
  String versionSql();

  /**
   * Whether a column of the given database type name holds JSON.
   */
  default boolean isJsonType(String typeName) {
    return "json".equalsIgnoreCase(typeName);
  }

  /**
   * Binds a JSON document as parameter {@code index}.
   */
  default void bindJson(PreparedStatement ps, int index, String json) throws SQLException {
    ps.setString(index, json);
  }

  /**
   * Number of parameter markers in a prepared statement.
   */
  default int parameterCount(PreparedStatement ps, String sql) throws SQLException {
    return ps.getParameterMetaData().getParameterCount();
  }
}
