package dbgate.jdbc;

import dbgate.config.ConnectionConfig;
import dbgate.config.DatabaseConfig;
import dbgate.engine.EngineFactory;
import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.jdbc.dialect.JdbcDialects;
import dbgate.spi.DatabaseEngine;

/**
 * Creates {@link JdbcEngine}s for engine type {@code "jdbc"}.
 *
 * <p>The dialect comes from the {@code dialect} connection option, or is detected from the URL.
 * Registered via {@code META-INF/services/dbgate.engine.EngineFactory}.
 */
public final class JdbcEngineFactory implements EngineFactory {
  public static final String DIALECT_OPTION = "dialect";

  @Override
  public String type() {
    return JdbcEngine.TYPE;
  }

  @Override
  public DatabaseEngine create(DatabaseConfig config) {
    ConnectionConfig connection = config.connection();
    JdbcEngine.Builder builder = JdbcEngine.builder().connectionConfig(connection);
    String dialectName = connection.options().get(DIALECT_OPTION);
    if (dialectName != null) {
      JdbcDialect dialect = JdbcDialects.get(dialectName);
      builder.dialect(dialect);
    }
    return builder.build();
  }
}
