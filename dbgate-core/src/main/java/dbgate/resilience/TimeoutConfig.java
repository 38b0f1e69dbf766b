package dbgate.resilience;

import dbgate.error.DatabaseException;

import java.time.Duration;

/**
 * Time budgets for the kinds of work the safety layer bounds.
 *
 * <p>Defaults: 30s default operations, 10s connection establishment, 60s query execution,
 * 5s pool operations, 3s health checks.
 */
public final class TimeoutConfig {
  private final Duration defaultTimeout;
  private final Duration connectionTimeout;
  private final Duration queryTimeout;
  private final Duration poolTimeout;
  private final Duration healthCheckTimeout;

  private TimeoutConfig(Builder builder) {
    this.defaultTimeout = positive(builder.defaultTimeout, "defaultTimeout");
    this.connectionTimeout = positive(builder.connectionTimeout, "connectionTimeout");
    this.queryTimeout = positive(builder.queryTimeout, "queryTimeout");
    this.poolTimeout = positive(builder.poolTimeout, "poolTimeout");
    this.healthCheckTimeout = positive(builder.healthCheckTimeout, "healthCheckTimeout");
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

  public static TimeoutConfig defaults() {
    return builder().build();
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  public Duration connectionTimeout() {
    return connectionTimeout;
  }

  public Duration queryTimeout() {
    return queryTimeout;
  }

  public Duration poolTimeout() {
    return poolTimeout;
  }

  public Duration healthCheckTimeout() {
    return healthCheckTimeout;
  }

  public static final class Builder {
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private Duration connectionTimeout = Duration.ofSeconds(10);
    private Duration queryTimeout = Duration.ofSeconds(60);
    private Duration poolTimeout = Duration.ofSeconds(5);
    private Duration healthCheckTimeout = Duration.ofSeconds(3);

    private Builder() {
    }

    public Builder defaultTimeout(Duration defaultTimeout) {
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    public Builder queryTimeout(Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
      return this;
    }

    public Builder poolTimeout(Duration poolTimeout) {
      this.poolTimeout = poolTimeout;
      return this;
    }

    public Builder healthCheckTimeout(Duration healthCheckTimeout) {
      this.healthCheckTimeout = healthCheckTimeout;
      return this;
    }

    public TimeoutConfig build() {
      return new TimeoutConfig(this);
    }
  }
}
