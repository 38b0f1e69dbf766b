package dbgate.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a transaction's identity and its open savepoints, oldest first.
 */
public record TransactionInfo(
    String id,
    IsolationLevel isolationLevel,
    Instant startedAt,
    List<String> savepoints,
    boolean readOnly) {

  public TransactionInfo {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(isolationLevel, "isolationLevel");
    Objects.requireNonNull(startedAt, "startedAt");
    savepoints = List.copyOf(savepoints);
  }
}
