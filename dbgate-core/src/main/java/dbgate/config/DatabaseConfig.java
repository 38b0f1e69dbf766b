package dbgate.config;

import dbgate.error.DatabaseException;

import java.util.Objects;

/**
 * Everything needed to register one backend: which engine type to instantiate and how to
 * connect, pool, police and narrow it.
 */
public final class DatabaseConfig {
  private final String engineType;
  private final ConnectionConfig connection;
  private final PoolConfig pool;
  private final SecurityConfig security;
  private final FeatureConfig features;

  private DatabaseConfig(Builder builder) {
    if (builder.engineType == null || builder.engineType.isBlank()) {
      throw DatabaseException.configuration("engineType must be set");
    }
    if (builder.connection == null) {
      throw DatabaseException.configuration("connection must be set");
    }
    this.engineType = builder.engineType;
    this.connection = builder.connection;
    this.pool = builder.pool != null ? builder.pool : PoolConfig.defaults();
    this.security = builder.security != null ? builder.security : SecurityConfig.defaults();
    this.features = builder.features != null ? builder.features : FeatureConfig.defaults();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String engineType() {
    return engineType;
  }

  public ConnectionConfig connection() {
    return connection;
  }

  public PoolConfig pool() {
    return pool;
  }

  public SecurityConfig security() {
    return security;
  }

  public FeatureConfig features() {
    return features;
  }

  public static final class Builder {
    private String engineType;
    private ConnectionConfig connection;
    private PoolConfig pool;
    private SecurityConfig security;
    private FeatureConfig features;

    private Builder() {
    }

    public Builder engineType(String engineType) {
      this.engineType = engineType;
      return this;
    }

    public Builder connection(ConnectionConfig connection) {
      this.connection = Objects.requireNonNull(connection, "connection");
      return this;
    }

    public Builder pool(PoolConfig pool) {
      this.pool = pool;
      return this;
    }

    public Builder security(SecurityConfig security) {
      this.security = security;
      return this;
    }

    public Builder features(FeatureConfig features) {
      this.features = features;
      return this;
    }

    public DatabaseConfig build() {
      return new DatabaseConfig(this);
    }
  }
}
