package dbgate;

import dbgate.config.DatabaseConfig;
import dbgate.error.DatabaseException;
import dbgate.engine.Engines;
import dbgate.model.DatabaseFeature;
import dbgate.model.DatabaseSchema;
import dbgate.model.ExecuteResult;
import dbgate.model.HealthStatus;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.Value;
import dbgate.pool.ConnectionPool;
import dbgate.pool.PoolManager;
import dbgate.pool.PooledConnection;
import dbgate.resilience.CircuitBreakerConfig;
import dbgate.resilience.ResourceMonitor;
import dbgate.resilience.SafetyManager;
import dbgate.resilience.TimeoutConfig;
import dbgate.spi.CallerContext;
import dbgate.spi.DatabaseEngine;
import dbgate.spi.MetricsExporter;
import dbgate.spi.QueryValidator;
import dbgate.spi.ValidationResult;
import dbgate.util.RequestIds;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Caller-facing entry point: query, command, schema and transaction operations against the
 * active registered database.
 *
 * <p>Every statement first passes the local statement policy of the database's
 * {@link dbgate.config.SecurityConfig} and then the external {@link QueryValidator}; a denied
 * statement fails with {@code SECURITY_VIOLATION} before any pool is touched. Borrowing is
 * admitted by the engine's {@link SafetyManager} (emergency check, circuit breaker), and each
 * backend call on the borrowed connection runs through it with a resource slot and deadline.
 * Connections are borrowed for the duration of one operation and always returned.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <pre>{@code
 * try (DatabaseGateway gateway = DatabaseGateway.builder().validator(validator).build()) {
 *     gateway.addDatabase("main", config);
 *     QueryResult rows = gateway.executeQuery("SELECT id FROM users WHERE name = ?",
 *         List.of(Value.of("ada")));
 * }
 * }</pre>
 */
public final class DatabaseGateway implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DatabaseGateway.class.getName());

  private final SafetyManager safety;
  private final PoolManager poolManager;
  private final QueryValidator validator;
  private final Map<String, DatabaseConfig> configs = new ConcurrentHashMap<>();
  private volatile String activeDatabase;

  private DatabaseGateway(Builder builder) {
    this.validator = builder.validator != null ? builder.validator : QueryValidator.ALLOW_ALL;
    this.safety = SafetyManager.builder()
        .name("gateway")
        .timeouts(builder.timeouts)
        .circuitBreaker(builder.circuitBreakerConfig)
        .resourceMonitor(builder.resourceMonitor)
        .metrics(builder.metrics)
        .build();
    this.poolManager = new PoolManager(safety);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the engine through the {@link Engines} registry and registers it. The first
   * database added becomes the active one.
   */
  public ConnectionPool addDatabase(String id, DatabaseConfig config) {
    return addDatabase(id, config, Engines.create(config));
  }

  public ConnectionPool addDatabase(String id, DatabaseConfig config, DatabaseEngine engine) {
    Objects.requireNonNull(config, "config");
    engine.validateConfig(config.connection());
    ConnectionPool pool = poolManager.addEngine(id, engine, config);
    configs.put(id, config);
    synchronized (this) {
      if (activeDatabase == null) {
        activeDatabase = id;
      }
    }
    return pool;
  }

  /**
   * Makes {@code id} the target of subsequent operations.
   */
  public synchronized void switchEngine(String id) {
    poolManager.getPool(id);
    String previous = activeDatabase;
    activeDatabase = id;
    logger.info("Active database switched from '" + previous + "' to '" + id + "'");
  }

  public boolean removeDatabase(String id) {
    synchronized (this) {
      if (id.equals(activeDatabase)) {
        activeDatabase = null;
      }
    }
    configs.remove(id);
    return poolManager.removeEngine(id);
  }

  public String activeDatabase() {
    return activeDatabase;
  }

  public QueryResult executeQuery(String statement, List<Value> params) {
    return executeQuery(CallerContext.ANONYMOUS, statement, params);
  }

  public QueryResult executeQuery(CallerContext caller, String statement, List<Value> params) {
    String id = requireActive();
    preflight(id, statement, caller);
    ConnectionPool pool = poolManager.getPool(id);
    logger.fine(() -> "query #" + RequestIds.nextRequestId() + " on '" + id + "' by " + caller.principal());
    try (PooledConnection connection = pool.acquire()) {
      return connection.query(statement, params);
    }
  }

  public ExecuteResult executeCommand(String statement, List<Value> params) {
    return executeCommand(CallerContext.ANONYMOUS, statement, params);
  }

  public ExecuteResult executeCommand(CallerContext caller, String statement, List<Value> params) {
    String id = requireActive();
    preflight(id, statement, caller);
    ConnectionPool pool = poolManager.getPool(id);
    logger.fine(() -> "command #" + RequestIds.nextRequestId() + " on '" + id + "' by " + caller.principal());
    try (PooledConnection connection = pool.acquire()) {
      return connection.execute(statement, params);
    }
  }

  /**
   * @throws DatabaseException {@code UNSUPPORTED_OPERATION} without borrowing a connection if
   *         the engine lacks {@link DatabaseFeature#SCHEMA_INTROSPECTION}
   */
  public DatabaseSchema getSchema() {
    String id = requireActive();
    ConnectionPool pool = poolManager.getPool(id);
    requireFeature(pool, DatabaseFeature.SCHEMA_INTROSPECTION, "schema introspection");
    try (PooledConnection connection = pool.acquire()) {
      return connection.schema();
    }
  }

  public GatewayTransaction beginTransaction(IsolationLevel isolationLevel) {
    return beginTransaction(CallerContext.ANONYMOUS, isolationLevel, false);
  }

  /**
   * Borrows a connection and opens a transaction on it. The connection stays with the returned
   * handle until it is committed, rolled back or closed.
   *
   * @throws DatabaseException {@code UNSUPPORTED_OPERATION} without borrowing a connection if
   *         the engine lacks {@link DatabaseFeature#TRANSACTIONS}
   */
  public GatewayTransaction beginTransaction(CallerContext caller, IsolationLevel isolationLevel, boolean readOnly) {
    String id = requireActive();
    ConnectionPool pool = poolManager.getPool(id);
    requireFeature(pool, DatabaseFeature.TRANSACTIONS, "transactions");
    PooledConnection connection = pool.acquire();
    try {
      return new GatewayTransaction(connection,
          connection.beginTransaction(isolationLevel, readOnly),
          statement -> preflight(id, statement, caller));
    } catch (RuntimeException e) {
      connection.close();
      throw e;
    }
  }

  public Map<String, HealthStatus> healthCheck() {
    return poolManager.healthCheckAll();
  }

  public PoolManager poolManager() {
    return poolManager;
  }

  public SafetyManager safety() {
    return safety;
  }

  @Override
  public void close() {
    try {
      poolManager.close();
    } finally {
      safety.close();
    }
  }

  private String requireActive() {
    String id = activeDatabase;
    if (id == null) {
      throw DatabaseException.configuration("no database registered");
    }
    return id;
  }

  private void preflight(String id, String statement, CallerContext caller) {
    DatabaseConfig config = configs.get(id);
    if (config == null) {
      throw DatabaseException.configuration("no database registered as '" + id + "'");
    }
    config.security().check(statement);
    ValidationResult verdict = validator.validate(statement, caller);
    if (verdict instanceof ValidationResult.Denied denied) {
      logger.warning("Statement from " + caller.principal() + " denied: " + denied.reason());
      throw DatabaseException.security("statement denied: " + denied.reason());
    }
    if (verdict instanceof ValidationResult.Warning warning) {
      logger.warning("Statement from " + caller.principal() + " allowed with warning: " + warning.message());
    }
  }

  private static void requireFeature(ConnectionPool pool, DatabaseFeature feature, String description) {
    if (!pool.features().contains(feature)) {
      throw DatabaseException.unsupported(description + " are not supported by engine '" + pool.engineId() + "'");
    }
  }

  public static final class Builder {
    private QueryValidator validator;
    private TimeoutConfig timeouts;
    private CircuitBreakerConfig circuitBreakerConfig;
    private ResourceMonitor resourceMonitor;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder validator(QueryValidator validator) {
      this.validator = validator;
      return this;
    }

    public Builder timeouts(TimeoutConfig timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public Builder circuitBreaker(CircuitBreakerConfig circuitBreakerConfig) {
      this.circuitBreakerConfig = circuitBreakerConfig;
      return this;
    }

    public Builder resourceMonitor(ResourceMonitor resourceMonitor) {
      this.resourceMonitor = resourceMonitor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DatabaseGateway build() {
      return new DatabaseGateway(this);
    }
  }
}
