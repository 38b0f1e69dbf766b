package dbgate.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a command.
 *
 * @param lastInsertId generated identifier, when the backend reports one
 */
public record ExecuteResult(long rowsAffected, Optional<Value> lastInsertId, Duration latency) {
  public ExecuteResult {
    if (rowsAffected < 0) {
      throw new IllegalArgumentException("rowsAffected must be >= 0, got: " + rowsAffected);
    }
    Objects.requireNonNull(lastInsertId, "lastInsertId");
    Objects.requireNonNull(latency, "latency");
  }

  public static ExecuteResult of(long rowsAffected, Duration latency) {
    return new ExecuteResult(rowsAffected, Optional.empty(), latency);
  }
}
