package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>Without a port the configured database is an in-memory one that lives until the JVM exits.
 */
public final class H2Dialect extends AbstractJdbcDialect {

  public H2Dialect() {
    super(DatabaseFeature.JSON_SUPPORT);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public List<String> productNames() {
    return List.of("H2");
  }

  @Override
  public String versionSql() {
    return "SELECT H2VERSION()";
  }

  @Override
  public String url(ConnectionConfig config) {
    String database = config.database() != null ? config.database() : "dbgate";
    if (config.port() > 0) {
      return "jdbc:h2:tcp://" + config.host() + ":" + config.port() + "/" + database;
    }
    return "jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1";
  }
}
