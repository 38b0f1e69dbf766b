package dbgate.jdbc;

import dbgate.config.ConnectionConfig;
import dbgate.error.DatabaseException;
import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.jdbc.dialect.JdbcDialects;
import dbgate.model.DatabaseFeature;
import dbgate.model.HealthStatus;
import dbgate.spi.DatabaseConnection;
import dbgate.spi.DatabaseEngine;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DatabaseEngine} over plain JDBC.
 *
 * <p>Sessions come from a {@link DataSource} when one is supplied (an external pool such as
 * HikariCP, for example), otherwise from {@link DriverManager} with the URL, credentials and
 * options of the {@link ConnectionConfig}. The dialect is detected from the URL when not given.
 *
 * <pre>{@code
 * DatabaseEngine engine = JdbcEngine.builder()
 *     .dataSource(hikariDataSource)
 *     .build();
 * }</pre>
 */
public final class JdbcEngine implements DatabaseEngine {
  private static final Logger logger = Logger.getLogger(JdbcEngine.class.getName());

  public static final String TYPE = "jdbc";

  private final DataSource dataSource;
  private final JdbcDialect dialect;
  private final ConnectionConfig healthConfig;
  private final Set<DatabaseFeature> features;
  private final Duration degradedLatency;
  private volatile String version;

  private JdbcEngine(Builder builder) {
    this.dataSource = builder.dataSource;
    this.healthConfig = builder.connectionConfig;
    this.dialect = builder.dialect != null ? builder.dialect : detectDialect(builder);
    this.features = builder.features != null ? Set.copyOf(builder.features) : dialect.features();
    this.degradedLatency = builder.degradedLatency;
  }

  public static Builder builder() {
    return new Builder();
  }

  private static JdbcDialect detectDialect(Builder builder) {
    if (builder.dataSource != null) {
      return JdbcDialects.detect(builder.dataSource);
    }
    if (builder.connectionConfig != null && builder.connectionConfig.url().isPresent()) {
      return JdbcDialects.detect(builder.connectionConfig.url().get());
    }
    throw DatabaseException.configuration("dialect cannot be detected without a DataSource or URL");
  }

  public JdbcDialect dialect() {
    return dialect;
  }

  @Override
  public String type() {
    return TYPE;
  }

  /**
   * The server version, queried once and then cached. "unknown" until a query succeeds.
   */
  @Override
  public String version() {
    String cached = version;
    if (cached != null) {
      return cached;
    }
    if (dataSource == null && healthConfig == null) {
      return "unknown";
    }
    try (Connection conn = open(healthConfig);
         PreparedStatement ps = conn.prepareStatement(dialect.versionSql());
         ResultSet rs = ps.executeQuery()) {
      if (rs.next()) {
        version = rs.getString(1);
        return version;
      }
    } catch (SQLException e) {
      logger.log(Level.FINE, "Version query failed for dialect " + dialect.name(), e);
    }
    return "unknown";
  }

  @Override
  public DatabaseConnection connect(ConnectionConfig config) {
    Connection conn;
    try {
      conn = open(config);
    } catch (SQLException e) {
      throw DatabaseException.connectionFailed(
          "Failed to connect (" + dialect.name() + "): " + e.getMessage(), e);
    }
    try {
      return new JdbcConnection(conn, dialect);
    } catch (SQLException e) {
      DatabaseException failure = DatabaseException.connectionFailed(
          "Failed to read connection metadata: " + e.getMessage(), e);
      try {
        conn.close();
      } catch (SQLException closeFailure) {
        failure.addSuppressed(closeFailure);
      }
      throw failure;
    }
  }

  /**
   * Opens a session and runs the dialect's health query on it. Critical when either fails,
   * degraded when the round trip is slower than the configured latency.
   */
  @Override
  public HealthStatus healthCheck() {
    if (dataSource == null && healthConfig == null) {
      return HealthStatus.critical(Duration.ZERO, "no DataSource or connection config to check");
    }
    long start = System.nanoTime();
    try (Connection conn = open(healthConfig);
         PreparedStatement ps = conn.prepareStatement(dialect.healthCheckSql());
         ResultSet rs = ps.executeQuery()) {
      rs.next();
      Duration latency = JdbcStatements.since(start);
      if (latency.compareTo(degradedLatency) > 0) {
        return HealthStatus.degraded(latency, "health query took " + latency.toMillis() + "ms");
      }
      return HealthStatus.healthy(latency);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Health check failed for dialect " + dialect.name(), e);
      return HealthStatus.critical(JdbcStatements.since(start), e.getMessage());
    }
  }

  @Override
  public Set<DatabaseFeature> supportedFeatures() {
    return features;
  }

  /**
   * Without a DataSource the configuration must yield a URL for this engine's dialect.
   */
  @Override
  public void validateConfig(ConnectionConfig config) {
    if (dataSource != null) {
      return;
    }
    if (config.url().isPresent()) {
      JdbcDialect detected = JdbcDialects.detect(config.url().get());
      if (!detected.name().equals(dialect.name())) {
        throw DatabaseException.configuration("URL is for dialect " + detected.name()
            + " but the engine uses " + dialect.name());
      }
    } else if (config.host() == null || config.host().isBlank()) {
      throw DatabaseException.configuration("host or url is required");
    }
  }

  private Connection open(ConnectionConfig config) throws SQLException {
    if (dataSource != null) {
      return dataSource.getConnection();
    }
    String url = config.url().orElseGet(() -> dialect.url(config));
    Properties props = new Properties();
    props.putAll(config.options());
    props.remove(JdbcEngineFactory.DIALECT_OPTION);
    if (config.username() != null) {
      props.setProperty("user", config.username());
    }
    if (config.password() != null) {
      props.setProperty("password", config.password());
    }
    return DriverManager.getConnection(url, props);
  }

  @Override
  public String toString() {
    return "JdbcEngine{" + dialect.name() + "}";
  }

  public static final class Builder {
    private DataSource dataSource;
    private JdbcDialect dialect;
    private ConnectionConfig connectionConfig;
    private Set<DatabaseFeature> features;
    private Duration degradedLatency = Duration.ofSeconds(1);

    private Builder() {
    }

    /**
     * Sessions come from this DataSource; the {@link ConnectionConfig} passed to
     * {@link #connect(ConnectionConfig)} is then only used for bookkeeping.
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    public Builder dialect(JdbcDialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Configuration used by {@link #healthCheck()} and {@link #version()} when there is no
     * DataSource.
     */
    public Builder connectionConfig(ConnectionConfig connectionConfig) {
      this.connectionConfig = connectionConfig;
      return this;
    }

    /** Replaces the features the dialect declares. */
    public Builder features(Set<DatabaseFeature> features) {
      this.features = features;
      return this;
    }

    public Builder degradedLatency(Duration degradedLatency) {
      this.degradedLatency = Objects.requireNonNull(degradedLatency, "degradedLatency");
      return this;
    }

    public JdbcEngine build() {
      return new JdbcEngine(this);
    }
  }
}
