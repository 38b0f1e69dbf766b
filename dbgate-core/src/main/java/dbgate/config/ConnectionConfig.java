package dbgate.config;

import dbgate.error.DatabaseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Where and how to open a backend connection.
 *
 * <p>Create instances via {@link #builder()}. An explicit {@link Builder#url(String)} takes
 * precedence over host, port and database for adapters that accept URLs.
 */
public final class ConnectionConfig {
  private final String host;
  private final int port;
  private final String database;
  private final String username;
  private final String password;
  private final String url;
  private final String sslMode;
  private final Duration connectTimeout;
  private final Map<String, String> options;

  private ConnectionConfig(Builder builder) {
    this.host = builder.host;
    this.port = builder.port;
    this.database = builder.database;
    this.username = builder.username;
    this.password = builder.password;
    this.url = builder.url;
    this.sslMode = builder.sslMode;
    this.connectTimeout = builder.connectTimeout;
    this.options = Map.copyOf(builder.options);

    if (url == null && (host == null || host.isBlank())) {
      throw DatabaseException.configuration("either url or host must be set");
    }
    if (port < 0 || port > 65535) {
      throw DatabaseException.configuration("port must be in [0, 65535], got: " + port);
    }
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw DatabaseException.configuration("connectTimeout must be > 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String database() {
    return database;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public Optional<String> url() {
    return Optional.ofNullable(url);
  }

  public String sslMode() {
    return sslMode;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Map<String, String> options() {
    return options;
  }

  @Override
  public String toString() {
    return "ConnectionConfig{" + (url != null ? url : host + ":" + port + "/" + database)
        + ", user=" + username + "}";
  }

  public static final class Builder {
    private String host = "localhost";
    private int port;
    private String database;
    private String username;
    private String password;
    private String url;
    private String sslMode = "prefer";
    private Duration connectTimeout = Duration.ofSeconds(30);
    private final Map<String, String> options = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder database(String database) {
      this.database = database;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder sslMode(String sslMode) {
      this.sslMode = sslMode;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder option(String key, String value) {
      this.options.put(key, value);
      return this;
    }

    public ConnectionConfig build() {
      return new ConnectionConfig(this);
    }
  }
}
