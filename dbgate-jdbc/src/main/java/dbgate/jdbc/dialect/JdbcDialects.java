package dbgate.jdbc.dialect;

import dbgate.error.DatabaseException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Looks up the {@link JdbcDialect} registered for a database.
 *
 * <p>Dialects come from {@code META-INF/services/dbgate.jdbc.dialect.JdbcDialect}; when two share
 * a name, the first one on the class path is kept. A dialect is found by its name, by the prefix
 * of a JDBC URL, or from a live connection. For a live connection the product name reported by
 * the driver decides and the URL is the fallback, so wrapping URLs such as
 * {@code jdbc:p6spy:postgresql://...} still resolve.
 *
 * <pre>{@code
 * JdbcDialect byUrl = JdbcDialects.detect("jdbc:postgresql://db.internal/orders");
 * JdbcDialect fromPool = JdbcDialects.detect(dataSource);
 * }</pre>
 */
public final class JdbcDialects {
  private static final Logger logger = Logger.getLogger(JdbcDialects.class.getName());

  private static final Map<String, JdbcDialect> REGISTERED = load();

  private JdbcDialects() {
  }

  private static Map<String, JdbcDialect> load() {
    Map<String, JdbcDialect> byName = new LinkedHashMap<>();
    for (JdbcDialect dialect : ServiceLoader.load(JdbcDialect.class)) {
      String key = dialect.name().toLowerCase(Locale.ROOT);
      JdbcDialect kept = byName.putIfAbsent(key, dialect);
      if (kept != null) {
        logger.warning("Ignoring dialect " + dialect.getClass().getName() + ": '" + key
            + "' is already provided by " + kept.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  /** Registered dialects in class-path order. */
  public static List<JdbcDialect> all() {
    return List.copyOf(REGISTERED.values());
  }

  /**
   * @param name dialect name, any case
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if no dialect has that name
   */
  public static JdbcDialect get(String name) {
    JdbcDialect dialect = name == null ? null : REGISTERED.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw DatabaseException.configuration("Unknown dialect: " + name
          + ". Available: " + REGISTERED.keySet());
    }
    return dialect;
  }

  /** The dialect whose URL prefix starts {@code jdbcUrl}. */
  public static Optional<JdbcDialect> forUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return REGISTERED.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  /** The dialect claiming the product name a driver reports, compared ignoring case. */
  public static Optional<JdbcDialect> forProductName(String productName) {
    if (productName == null) {
      return Optional.empty();
    }
    String product = productName.trim();
    return REGISTERED.values().stream()
        .filter(d -> d.productNames().stream().anyMatch(product::equalsIgnoreCase))
        .findFirst();
  }

  /**
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if the URL is blank or no dialect
   *         claims it
   */
  public static JdbcDialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw DatabaseException.configuration("JDBC URL cannot be null or empty");
    }
    return forUrl(jdbcUrl).orElseThrow(() -> DatabaseException.configuration(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + prefixes()));
  }

  /**
   * Borrows one connection from {@code dataSource} and detects the dialect from it.
   *
   * @throws DatabaseException {@code CONNECTION_FAILED} if no connection could be obtained,
   *         {@code CONFIGURATION_ERROR} if no dialect matches
   */
  public static JdbcDialect detect(DataSource dataSource) {
    try (Connection connection = dataSource.getConnection()) {
      return detect(connection);
    } catch (SQLException e) {
      throw DatabaseException.connectionFailed("Failed to detect dialect from DataSource", e);
    }
  }

  /**
   * Detects the dialect from the product name the driver reports, then from the URL.
   *
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if neither matches
   */
  public static JdbcDialect detect(Connection connection) throws SQLException {
    DatabaseMetaData meta = connection.getMetaData();
    String product = meta.getDatabaseProductName();
    String url = meta.getURL();
    return forProductName(product)
        .or(() -> forUrl(url))
        .orElseThrow(() -> DatabaseException.configuration("No dialect found for product '"
            + product + "' at " + url + ". Available: " + REGISTERED.keySet()));
  }

  private static List<String> prefixes() {
    List<String> prefixes = new ArrayList<>();
    REGISTERED.values().forEach(d -> prefixes.addAll(d.jdbcUrlPrefixes()));
    return prefixes;
  }
}
