package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base dialect for transactional SQL databases.
 *
 * <p>Declares transactions, savepoints, prepared statements, schema introspection and ACID;
 * subclasses add their extras and the URL layout of their driver.
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {

  private final Set<DatabaseFeature> features;

  protected AbstractJdbcDialect(DatabaseFeature... extras) {
    EnumSet<DatabaseFeature> all = EnumSet.of(
        DatabaseFeature.TRANSACTIONS,
        DatabaseFeature.SAVEPOINTS,
        DatabaseFeature.PREPARED_STATEMENTS,
        DatabaseFeature.SCHEMA_INTROSPECTION,
        DatabaseFeature.ACID);
    for (DatabaseFeature extra : extras) {
      all.add(extra);
    }
    this.features = Set.copyOf(all);
  }

  @Override
  public Set<DatabaseFeature> features() {
    return features;
  }

  /**
   * {@code <prefix>//host:port/database}, with the default port when none is configured.
   */
  protected static String networkUrl(String prefix, ConnectionConfig config, int defaultPort) {
    int port = config.port() > 0 ? config.port() : defaultPort;
    String database = config.database() != null ? config.database() : "";
    return prefix + "//" + config.host() + ":" + port + "/" + database;
  }

  @Override
  public String toString() {
    return name();
  }
}
