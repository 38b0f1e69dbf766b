package dbgate.config;

import dbgate.error.DatabaseException;

import java.time.Duration;

/**
 * Sizing and lifetime limits of one connection pool.
 *
 * <p>Defaults: 20 max, 5 min, 30s acquire timeout, 300s idle timeout, 3600s max lifetime,
 * maintenance every 60s, ping on reuse, 10s drain on close.
 */
public final class PoolConfig {
  private final int maxConnections;
  private final int minConnections;
  private final Duration connectionTimeout;
  private final Duration idleTimeout;
  private final Duration maxLifetime;
  private final Duration maintenanceInterval;
  private final boolean validateOnAcquire;
  private final Duration drainTimeout;

  private PoolConfig(Builder builder) {
    this.maxConnections = builder.maxConnections;
    this.minConnections = builder.minConnections;
    this.connectionTimeout = positive(builder.connectionTimeout, "connectionTimeout");
    this.idleTimeout = positive(builder.idleTimeout, "idleTimeout");
    this.maxLifetime = positive(builder.maxLifetime, "maxLifetime");
    this.maintenanceInterval = positive(builder.maintenanceInterval, "maintenanceInterval");
    this.validateOnAcquire = builder.validateOnAcquire;
    this.drainTimeout = positive(builder.drainTimeout, "drainTimeout");

    if (maxConnections < 1) {
      throw DatabaseException.configuration("maxConnections must be >= 1, got: " + maxConnections);
    }
    if (minConnections < 0) {
      throw DatabaseException.configuration("minConnections must be >= 0, got: " + minConnections);
    }
    if (minConnections > maxConnections) {
      throw DatabaseException.configuration("minConnections (" + minConnections
          + ") must not exceed maxConnections (" + maxConnections + ")");
    }
  }

  private static Duration positive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw DatabaseException.configuration(name + " must be > 0");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PoolConfig defaults() {
    return builder().build();
  }

  public int maxConnections() {
    return maxConnections;
  }

  public int minConnections() {
    return minConnections;
  }

  public Duration connectionTimeout() {
    return connectionTimeout;
  }

  public Duration idleTimeout() {
    return idleTimeout;
  }

  public Duration maxLifetime() {
    return maxLifetime;
  }

  public Duration maintenanceInterval() {
    return maintenanceInterval;
  }

  public boolean validateOnAcquire() {
    return validateOnAcquire;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public static final class Builder {
    private int maxConnections = 20;
    private int minConnections = 5;
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofSeconds(300);
    private Duration maxLifetime = Duration.ofSeconds(3600);
    private Duration maintenanceInterval = Duration.ofSeconds(60);
    private boolean validateOnAcquire = true;
    private Duration drainTimeout = Duration.ofSeconds(10);

    private Builder() {
    }

    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder minConnections(int minConnections) {
      this.minConnections = minConnections;
      return this;
    }

    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    public Builder maxLifetime(Duration maxLifetime) {
      this.maxLifetime = maxLifetime;
      return this;
    }

    public Builder maintenanceInterval(Duration maintenanceInterval) {
      this.maintenanceInterval = maintenanceInterval;
      return this;
    }

    public Builder validateOnAcquire(boolean validateOnAcquire) {
      this.validateOnAcquire = validateOnAcquire;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public PoolConfig build() {
      return new PoolConfig(this);
    }
  }
}
