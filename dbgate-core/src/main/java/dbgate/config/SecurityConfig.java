package dbgate.config;

import dbgate.error.DatabaseException;
import dbgate.model.QueryType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Local statement policy checked before any statement reaches a pool.
 */
public final class SecurityConfig {
  private final int maxQueryLength;
  private final Set<QueryType> allowedOperations;

  private SecurityConfig(Builder builder) {
    if (builder.maxQueryLength < 1) {
      throw DatabaseException.configuration("maxQueryLength must be >= 1, got: " + builder.maxQueryLength);
    }
    if (builder.allowedOperations.isEmpty()) {
      throw DatabaseException.configuration("allowedOperations must not be empty");
    }
    this.maxQueryLength = builder.maxQueryLength;
    this.allowedOperations = Set.copyOf(builder.allowedOperations);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SecurityConfig defaults() {
    return builder().build();
  }

  public int maxQueryLength() {
    return maxQueryLength;
  }

  public Set<QueryType> allowedOperations() {
    return allowedOperations;
  }

  /**
   * Rejects statements that are too long or whose category is not allowed.
   *
   * @throws DatabaseException with {@code SECURITY_VIOLATION}
   */
  public void check(String statement) {
    if (statement == null || statement.isBlank()) {
      throw DatabaseException.validation("statement must not be empty");
    }
    if (statement.length() > maxQueryLength) {
      throw DatabaseException.security("statement length " + statement.length()
          + " exceeds limit " + maxQueryLength);
    }
    QueryType type = QueryType.classify(statement);
    if (!allowedOperations.contains(type)) {
      throw DatabaseException.security("operation " + type + " is not allowed");
    }
  }

  public static final class Builder {
    private int maxQueryLength = 10_000;
    private final Set<QueryType> allowedOperations = EnumSet.of(
        QueryType.SELECT, QueryType.INSERT, QueryType.UPDATE, QueryType.DELETE);

    private Builder() {
    }

    public Builder maxQueryLength(int maxQueryLength) {
      this.maxQueryLength = maxQueryLength;
      return this;
    }

    public Builder allowedOperations(Set<QueryType> allowedOperations) {
      this.allowedOperations.clear();
      this.allowedOperations.addAll(allowedOperations);
      return this;
    }

    public Builder allow(QueryType... types) {
      for (QueryType type : types) {
        this.allowedOperations.add(type);
      }
      return this;
    }

    public SecurityConfig build() {
      return new SecurityConfig(this);
    }
  }
}
