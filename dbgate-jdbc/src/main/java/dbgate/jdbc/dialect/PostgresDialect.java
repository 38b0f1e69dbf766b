package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * PostgreSQL dialect. JSON parameters are sent untyped so the server casts them to
 * {@code json} or {@code jsonb} as the target column requires.
 */
public final class PostgresDialect extends AbstractJdbcDialect {

  public PostgresDialect() {
    super(DatabaseFeature.JSON_SUPPORT, DatabaseFeature.FULL_TEXT_SEARCH,
        DatabaseFeature.STORED_PROCEDURES, DatabaseFeature.REPLICATION);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<String> productNames() {
    return List.of("PostgreSQL");
  }

  @Override
  public String versionSql() {
    return "SELECT version()";
  }

  @Override
  public String url(ConnectionConfig config) {
    String url = networkUrl("jdbc:postgresql:", config, 5432);
    if (config.sslMode() != null) {
      url += "?sslmode=" + config.sslMode();
    }
    return url;
  }

  @Override
  public boolean isJsonType(String typeName) {
    return "json".equalsIgnoreCase(typeName) || "jsonb".equalsIgnoreCase(typeName);
  }

  @Override
  public void bindJson(PreparedStatement ps, int index, String json) throws SQLException {
    ps.setObject(index, json, Types.OTHER);
  }
}
